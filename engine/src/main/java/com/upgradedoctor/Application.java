package com.upgradedoctor;

import com.upgradedoctor.service.DoctorRunner;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;

public class Application {
    public static void main(String[] args) {
        int exitCode;
        try (ApplicationContext context = Micronaut.run(Application.class, args)) {
            exitCode = context.getBean(DoctorRunner.class).run();
        }
        System.exit(exitCode);
    }
}
