package com.hiltest.presentation.cli;

import org.springframework.beans.BeansException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Fábrica de picocli que obtiene los comandos del contexto de Spring, de
 * modo que reciben los servicios por inyección.
 */
@Component
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext applicationContext;

    public SpringCommandFactory(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        try {
            return applicationContext.getBean(cls);
        } catch (BeansException e) {
            // clases internas de picocli (conversores, proveedores de versión...)
            return CommandLine.defaultFactory().create(cls);
        }
    }
}
