package org.arcx.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.arcx.options.ArcxOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = ArcxOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = ArcxOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = ArcxOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<ArcxConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 arcx.yaml을 찾습니다.
     */
    private Optional<ArcxConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), ArcxConfiguration.class));
                } catch (IOException e) {
                    System.err.println("Warning: Failed to parse " + configFile + ": " + e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(ArcxConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            System.err.println("Warning: Profile '" + profile + "' not found in configuration. Using defaults.");
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getNaming() != null && profileConfig.getNaming().getMaxLength() != null) {
            configMap.put(ArcxOptions.Naming.MAX_LENGTH_KEY,
                         String.valueOf(profileConfig.getNaming().getMaxLength()));
        }
        if (profileConfig.getDatabase() != null && profileConfig.getDatabase().getDialect() != null) {
            configMap.put(ArcxOptions.Database.DIALECT_KEY, profileConfig.getDatabase().getDialect());
        }
        if (profileConfig.getOutput() != null && profileConfig.getOutput().getDirectory() != null) {
            configMap.put(ArcxOptions.Output.DIRECTORY_KEY, profileConfig.getOutput().getDirectory());
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            ArcxOptions.Naming.MAX_LENGTH_KEY, String.valueOf(ArcxOptions.Naming.MAX_LENGTH_DEFAULT),
            ArcxOptions.Database.DIALECT_KEY, ArcxOptions.Database.DIALECT_DEFAULT,
            ArcxOptions.Output.DIRECTORY_KEY, ArcxOptions.Output.DIRECTORY_DEFAULT
        );
    }
}
