package com.openforge.promptyoself;

import com.openforge.promptyoself.config.SchedulerProperties;
import com.openforge.promptyoself.letta.LettaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({LettaProperties.class, SchedulerProperties.class})
public class PromptYourselfApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptYourselfApplication.class, args);
    }
}
