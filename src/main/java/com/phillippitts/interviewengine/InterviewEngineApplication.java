package com.phillippitts.interviewengine;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.config.properties.DownstreamProperties;
import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.config.properties.LlmProperties;
import com.phillippitts.interviewengine.config.properties.RelayCredentialProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        InterviewProperties.class,
        CapabilityTimeoutProperties.class,
        RelayCredentialProperties.class,
        DownstreamProperties.class,
        LlmProperties.class
})
@EnableScheduling
public class InterviewEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewEngineApplication.class, args);
    }

}
