package com.myorg.specdiff.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where uploaded documents and comparison outputs are stored ({@code storage.*}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    private String basePath = "output";
}
