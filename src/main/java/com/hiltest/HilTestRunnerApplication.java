package com.hiltest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Aplicación principal del ejecutor de planes de prueba HIL.
 *
 * Ejecuta pruebas de MicroPython sobre placas conectadas por puerto serie,
 * reiniciando los dispositivos mediante hubs USB con control de alimentación.
 */
@SpringBootApplication
public class HilTestRunnerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HilTestRunnerApplication.class, args)));
    }
}
