package com.replyline.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient for the streaming calls to completion providers.
 * The response timeout bounds the gap between streamed chunks, not the whole stream.
 */
@Configuration
public class WebClientConfiguration {

    @Bean
    public WebClient webClient(ReplylineProperties properties) {
        ReplylineProperties.ProxyConfig proxy = properties.getProxy();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) proxy.getConnectTimeout().toMillis())
                .responseTimeout(proxy.getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
