package com.gdin.affinity.exception;

/**
 * 配置非法（分辨率 <= 0、top-N 为负等），在任何计算开始之前抛出。
 */
public class InvalidClusterConfigurationException extends IllegalArgumentException {

    public InvalidClusterConfigurationException(String message) {
        super(message);
    }
}
