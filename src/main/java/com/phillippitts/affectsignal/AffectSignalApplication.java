package com.phillippitts.affectsignal;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.config.properties.NormalizerProperties;
import com.phillippitts.affectsignal.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        InferenceProperties.class,
        NormalizerProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AffectSignalApplication {

    public static void main(String[] args) {
        SpringApplication.run(AffectSignalApplication.class, args);
    }

}
