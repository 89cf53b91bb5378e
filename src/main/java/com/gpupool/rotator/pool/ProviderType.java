package com.gpupool.rotator.pool;

/**
 * 计算资源提供方
 */
public enum ProviderType {
    GOOGLE_COLAB,
    KAGGLE,
    LIGHTNING_AI,
    HUGGING_FACE,
    PAPERSPACE,
    SATURN_CLOUD,
    RUNPOD,
    VAST,
    LAMBDA,
    LOCAL,
    CUSTOM
}
