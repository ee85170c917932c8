package com.phillippitts.guardian;

import com.phillippitts.guardian.config.properties.BrownoutProperties;
import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.config.properties.InferenceBackendProperties;
import com.phillippitts.guardian.config.properties.KillSequenceProperties;
import com.phillippitts.guardian.config.properties.ServingApiProperties;
import com.phillippitts.guardian.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GuardianProperties.class,
        BrownoutProperties.class,
        KillSequenceProperties.class,
        ServingApiProperties.class,
        InferenceBackendProperties.class,
        ThreadPoolProperties.class
})
public class GuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardianApplication.class, args);
    }

}
