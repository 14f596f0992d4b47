package com.z254.butterfly.prognos;

import com.z254.butterfly.prognos.config.PrognosProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * PROGNOS - Error Prediction and Prevention Engine for the BUTTERFLY Ecosystem.
 *
 * <p>PROGNOS provides:
 * <ul>
 *   <li>Ensemble forecasting of error count, error rate, business impact and system health</li>
 *   <li>Multi-algorithm anomaly detection with fusion and ranking</li>
 *   <li>Prevention strategy selection and execution</li>
 *   <li>Asynchronous model retraining driven by schedule and observed accuracy</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(PrognosProperties.class)
public class PrognosApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrognosApplication.class, args);
    }
}
