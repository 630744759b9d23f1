package com.example.predictor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.predictor.config.AnalyticsProperties;
import com.example.predictor.config.AppConfig;
import com.example.predictor.config.InsightsProperties;
import com.example.predictor.config.ModelRegistryProperties;
import com.example.predictor.config.PredictionProperties;
import com.example.predictor.config.ProxyProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    AppConfig.class,
    PredictionProperties.class,
    ModelRegistryProperties.class,
    AnalyticsProperties.class,
    InsightsProperties.class,
    ProxyProperties.class
})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
