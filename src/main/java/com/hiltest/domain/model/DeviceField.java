package com.hiltest.domain.model;

import com.hiltest.domain.exception.ConfigurationException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Campos consultables de un dispositivo.
 *
 * Cada campo pertenece a una parte del dispositivo (el propio registro, su
 * acceso serie o su interruptor) y tiene un accesor explícito. Un campo sin
 * valor en un dispositivo concreto devuelve un Optional vacío.
 */
public enum DeviceField {
    NAME("name", Scope.DEVICE, d -> single(d.getName())),
    UID("uid", Scope.DEVICE, d -> single(d.getUid())),
    FEATURES("features", Scope.DEVICE, d -> List.copyOf(d.getFeatures())),
    ADDRESS("address", Scope.ACCESS, d -> d.getAccess() == null ? List.of() : single(d.getAccess().getAddress())),
    SERIAL_NUMBER("serial_number", Scope.ACCESS,
            d -> d.getAccess() == null ? List.of() : single(d.getAccess().getSerialNumber())),
    HUB("hub", Scope.SWITCH, d -> d.getPowerSwitch() == null ? List.of() : single(d.getPowerSwitch().getHub())),
    PORT("port", Scope.SWITCH, d -> d.getPowerSwitch() == null || d.getPowerSwitch().getPort() == null
            ? List.of()
            : List.of(String.valueOf(d.getPowerSwitch().getPort())));

    /**
     * Parte del dispositivo a la que pertenece el campo.
     */
    public enum Scope {
        DEVICE,
        ACCESS,
        SWITCH
    }

    private final String key;
    private final Scope scope;
    private final Function<Device, List<String>> accessor;

    DeviceField(String key, Scope scope, Function<Device, List<String>> accessor) {
        this.key = key;
        this.scope = scope;
        this.accessor = accessor;
    }

    public String getKey() {
        return key;
    }

    public Scope getScope() {
        return scope;
    }

    /**
     * Todos los valores del campo en el dispositivo (varios solo para features).
     */
    public List<String> values(Device device) {
        return accessor.apply(device);
    }

    /**
     * Valor del campo, con varios valores unidos por comas.
     */
    public Optional<String> value(Device device) {
        List<String> values = values(device);
        return values.isEmpty() ? Optional.empty() : Optional.of(String.join(",", values));
    }

    /**
     * Busca un campo por su nombre.
     *
     * @throws ConfigurationException si el nombre no corresponde a ningún campo
     */
    public static DeviceField fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equals(key))
                .findFirst()
                .orElseThrow(() -> ConfigurationException.unknownField(key));
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(DeviceField::getKey).toList();
    }

    private static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }
}
