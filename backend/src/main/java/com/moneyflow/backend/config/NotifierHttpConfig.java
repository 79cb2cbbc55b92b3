package com.moneyflow.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class NotifierHttpConfig {

    @Bean
    public RestTemplate notifierRestTemplate(NotifierProperties notifierProperties) {
        NotifierProperties.Slack slack = notifierProperties.getSlack();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(slack.getConnectTimeoutMs());
        factory.setReadTimeout(slack.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
