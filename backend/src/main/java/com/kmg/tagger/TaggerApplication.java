package com.kmg.tagger;

import com.kmg.tagger.config.CommandLineJobRunner;
import com.kmg.tagger.config.TaggerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(TaggerProperties.class)
public class TaggerApplication {
    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(TaggerApplication.class);
        if (!CommandLineJobRunner.isCommandLineInvocation(args)) {
            application.run(args);
            return;
        }

        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}
