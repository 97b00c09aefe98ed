package com.phillippitts.affectsignal.config;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.service.inference.DefaultInferenceJobClient;
import com.phillippitts.affectsignal.service.inference.InferenceApi;
import com.phillippitts.affectsignal.service.inference.InferenceJobClient;
import com.phillippitts.affectsignal.service.inference.RestInferenceApi;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

/**
 * Wires the remote inference client: HTTP transport with timeouts, then the polling client on
 * the inference scheduler.
 */
@Configuration
public class InferenceConfig {

    private static final Logger LOG = LogManager.getLogger(InferenceConfig.class);

    @Bean
    public InferenceApi inferenceApi(RestClient.Builder restClientBuilder, InferenceProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getConnectTimeoutMs());
        requestFactory.setReadTimeout(props.getReadTimeoutMs());
        LOG.info("Inference API at {} (connectTimeoutMs={}, readTimeoutMs={}, apiKey={})",
                props.getBaseUrl(), props.getConnectTimeoutMs(), props.getReadTimeoutMs(),
                props.hasApiKey() ? "configured" : "missing");
        return RestInferenceApi.create(restClientBuilder.requestFactory(requestFactory), props);
    }

    @Bean
    public InferenceJobClient inferenceJobClient(InferenceApi inferenceApi,
                                                 @Qualifier("inferenceScheduler") ThreadPoolTaskScheduler scheduler,
                                                 InferenceProperties props) {
        return new DefaultInferenceJobClient(inferenceApi, scheduler.getScheduledExecutor(), props);
    }
}
