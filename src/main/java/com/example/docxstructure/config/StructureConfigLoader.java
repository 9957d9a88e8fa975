package com.example.docxstructure.config;

import com.example.docxstructure.exception.StructureConfigException;
import com.example.docxstructure.util.docx.structure.StructureConfigValidator;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * 结构化配置加载
 *
 * 位置写法：
 * - classpath:structure.yaml
 * - 文件路径（可带 file: 前缀）
 *
 * 未出现的键使用默认值；读取或解析失败、校验失败都抛 {@link StructureConfigException}。
 */
@Slf4j
public class StructureConfigLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";
    public static final String FILE_PREFIX = "file:";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public StructureConfig load(String location) {
        if (location == null || location.trim().isEmpty()) {
            throw new StructureConfigException("结构化配置位置为空");
        }
        String trimmed = location.trim();
        if (trimmed.startsWith(CLASSPATH_PREFIX)) {
            return loadFromClasspath(trimmed.substring(CLASSPATH_PREFIX.length()));
        }
        if (trimmed.startsWith(FILE_PREFIX)) {
            trimmed = trimmed.substring(FILE_PREFIX.length());
        }
        return load(new File(trimmed));
    }

    public StructureConfig load(File file) {
        if (!file.isFile()) {
            throw new StructureConfigException("结构化配置文件不存在: " + file.getAbsolutePath());
        }
        try {
            StructureConfig config = YAML_MAPPER.readValue(file, StructureConfig.class);
            log.info("已加载结构化配置: {}", file.getAbsolutePath());
            return checked(config, file.getPath());
        } catch (IOException e) {
            throw new StructureConfigException("结构化配置解析失败: " + file.getAbsolutePath(), e);
        }
    }

    public StructureConfig load(InputStream in, String sourceName) {
        try {
            return checked(YAML_MAPPER.readValue(in, StructureConfig.class), sourceName);
        } catch (IOException e) {
            throw new StructureConfigException("结构化配置解析失败: " + sourceName, e);
        }
    }

    private StructureConfig loadFromClasspath(String resource) {
        String path = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = StructureConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                throw new StructureConfigException("classpath 中找不到结构化配置: " + path);
            }
            StructureConfig config = load(in, CLASSPATH_PREFIX + path);
            log.info("已加载结构化配置: {}{}", CLASSPATH_PREFIX, path);
            return config;
        } catch (IOException e) {
            throw new StructureConfigException("结构化配置读取失败: " + path, e);
        }
    }

    private StructureConfig checked(StructureConfig config, String sourceName) {
        if (config == null) {
            // YAML 内容为 null（如只有 ~）
            log.warn("结构化配置为空，使用默认值: {}", sourceName);
            config = new StructureConfig();
        }
        StructureConfigValidator.validate(config);
        return config;
    }
}
