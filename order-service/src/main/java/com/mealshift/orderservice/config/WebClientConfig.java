package com.mealshift.orderservice.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient timeReferenceWebClient(WebClient.Builder builder, MealshiftProperties properties) {
        int timeoutMillis = (int) properties.getClock().getTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .responseTimeout(properties.getClock().getTimeout());
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
