package com.example.docxstructure.config;

import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StructureConfiguration {

    @Value("${docx.structure.config-location:classpath:structure.yaml}")
    private String configLocation;

    @Bean
    public StructureConfigLoader structureConfigLoader() {
        return new StructureConfigLoader();
    }

    /**
     * 启动时加载并校验，配置无效则应用启动失败
     */
    @Bean
    public StructureConfig structureConfig(StructureConfigLoader structureConfigLoader) {
        return structureConfigLoader.load(configLocation);
    }
}
