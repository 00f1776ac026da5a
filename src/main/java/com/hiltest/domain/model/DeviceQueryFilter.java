package com.hiltest.domain.model;

import com.hiltest.domain.exception.ConfigurationException;

import java.util.Objects;

/**
 * Filtro de consulta sobre un campo de dispositivo.
 * Formato textual: {@code campo=valor} (exacto) o {@code campo~valor} (contiene).
 */
public record DeviceQueryFilter(DeviceField field, String value, boolean exact) {

    public DeviceQueryFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    public boolean matches(Device device) {
        return field.values(device).stream()
                .anyMatch(v -> exact ? v.equals(value) : v.contains(value));
    }

    public static DeviceQueryFilter parse(String expression) {
        int eq = expression.indexOf('=');
        int tilde = expression.indexOf('~');
        int sep;
        boolean exact;
        if (eq > 0 && (tilde < 0 || eq < tilde)) {
            sep = eq;
            exact = true;
        } else if (tilde > 0) {
            sep = tilde;
            exact = false;
        } else {
            throw new ConfigurationException("El filtro debe tener el formato 'campo=valor' o 'campo~valor': " + expression);
        }
        DeviceField field = DeviceField.fromKey(expression.substring(0, sep).trim());
        return new DeviceQueryFilter(field, expression.substring(sep + 1), exact);
    }
}
