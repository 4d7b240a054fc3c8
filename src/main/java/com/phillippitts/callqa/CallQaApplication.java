package com.phillippitts.callqa;

import com.phillippitts.callqa.config.properties.AggregationProperties;
import com.phillippitts.callqa.config.properties.EmbeddingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AggregationProperties.class,
        EmbeddingProperties.class
})
public class CallQaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallQaApplication.class, args);
    }

}
