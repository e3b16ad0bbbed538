package io.b2mash.sitediary.storage.local;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("storage.local")
public record LocalStorageProperties(@DefaultValue("uploads") String rootDir) {}
