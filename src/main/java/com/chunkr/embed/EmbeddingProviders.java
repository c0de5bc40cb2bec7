package com.chunkr.embed;

import java.time.Duration;

import com.chunkr.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(OkHttpClient httpClient, AppConfig.EmbeddingsConfig config) {
        OkHttpClient timed = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .build();
        return new HttpEmbeddingProvider(
                timed,
                HttpEmbeddingProvider.Kind.fromName(config.getProvider()),
                config.getBaseUrl(),
                config.getModel(),
                config.getApiKey());
    }
}
