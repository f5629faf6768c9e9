package com.bko.intervalcoach.documentation;

import com.bko.intervalcoach.IntervalCoachApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.modulith.core.ApplicationModules;
import org.springframework.modulith.docs.Documenter;
import org.springframework.stereotype.Component;

/**
 * Writes module canvases and component diagrams of the coach on startup when enabled.
 */
@Component
@ConditionalOnProperty(prefix = "modulith.docs", name = "enabled", havingValue = "true")
public class ModulithDocumentationGenerator implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(ModulithDocumentationGenerator.class);

    private final String outputFolder;

    public ModulithDocumentationGenerator(
            @Value("${modulith.docs.output:target/modulith-docs}") String outputFolder) {
        this.outputFolder = outputFolder;
    }

    @Override
    public void run(ApplicationArguments args) {
        logger.info("Writing module documentation for IntervalCoach into {}", outputFolder);
        ApplicationModules modules = ApplicationModules.of(IntervalCoachApplication.class);
        new Documenter(modules, outputFolder)
                .writeModulesAsPlantUml()
                .writeIndividualModulesAsPlantUml()
                .writeModuleCanvases();
        logger.info("Module documentation written.");
    }
}
