package com.eh.digitalpathology.dicomrelay.config;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HttpClientConfig {

    @Bean( destroyMethod = "close" )
    public CloseableHttpClient dicomWebHttpClient ( RelayConfig relayConfig ) {
        int connectTimeout = (int) relayConfig.getHttp( ).getConnectTimeout( ).toMillis( );
        int socketTimeout = (int) relayConfig.getHttp( ).getSocketTimeout( ).toMillis( );
        RequestConfig requestConfig = RequestConfig.custom( ).setSocketTimeout( socketTimeout ).setConnectTimeout( connectTimeout ).setConnectionRequestTimeout( connectTimeout ).build( );
        return HttpClients.custom( ).setDefaultRequestConfig( requestConfig ).setMaxConnTotal( 20 ).setMaxConnPerRoute( 10 ).build( );
    }
}
