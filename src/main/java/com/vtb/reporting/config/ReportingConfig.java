package com.vtb.reporting.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.reporting.core.FindingFilter;
import com.vtb.reporting.core.RecordErrorPolicy;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.models.RiskThresholds;
import com.vtb.reporting.reports.TableSelection;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Конфигурация построения отчетов из YAML файла.
 * Отсутствующие секции заполняются значениями по умолчанию.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportingConfig {

    public static final String DEFAULT_RESOURCE = "reporting-config.yaml";

    private Thresholds thresholds;
    private Tables tables;
    private Filter filter;
    private RecordErrorPolicy errorPolicy;
    private Output output;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static ReportingConfig load() {
        try (InputStream is = ReportingConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из файла
     */
    public static ReportingConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Файл конфигурации не найден: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация без файла: все значения по умолчанию
     */
    public static ReportingConfig defaults() {
        ReportingConfig config = new ReportingConfig();
        config.ensureDefaults();
        return config;
    }

    private static ReportingConfig read(InputStream is) throws IOException {
        // уровни и политика в YAML принимаются в любом регистре, как и в --levels
        ObjectMapper mapper = JsonMapper.builder(new YAMLFactory())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
        ReportingConfig config = mapper.readValue(is, ReportingConfig.class);
        if (config == null) {
            config = new ReportingConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (thresholds == null) {
            thresholds = new Thresholds();
        }
        if (tables == null) {
            tables = new Tables();
        }
        if (filter == null) {
            filter = new Filter();
        }
        filter.ensureDefaults();
        if (errorPolicy == null) {
            errorPolicy = RecordErrorPolicy.SKIP;
        }
        if (output == null) {
            output = new Output();
        }
        output.ensureDefaults();
    }

    public RiskThresholds toRiskThresholds() {
        return thresholds.toRiskThresholds();
    }

    public TableSelection toTableSelection() {
        return tables.toTableSelection();
    }

    public FindingFilter toFindingFilter() {
        return filter.toFindingFilter();
    }

    @Data
    public static class Thresholds {
        private Double low = 0.0;
        private Double medium = 4.0;
        private Double high = 7.0;
        private Double critical = 9.0;

        public RiskThresholds toRiskThresholds() {
            RiskThresholds defaults = RiskThresholds.defaults();
            return new RiskThresholds(
                low != null ? low : defaults.getLow(),
                medium != null ? medium : defaults.getMedium(),
                high != null ? high : defaults.getHigh(),
                critical != null ? critical : defaults.getCritical());
        }
    }

    @Data
    public static class Tables {
        private Boolean byVulnerability = Boolean.TRUE;
        private Boolean byHost = Boolean.TRUE;
        private Boolean summary = Boolean.TRUE;

        public TableSelection toTableSelection() {
            return TableSelection.builder()
                .includeByVulnerability(byVulnerability == null || byVulnerability)
                .includeByHost(byHost == null || byHost)
                .includeSummary(summary == null || summary)
                .build();
        }
    }

    @Data
    public static class Filter {
        private List<RiskLevel> includedLevels;
        private List<String> includedHosts;
        private List<String> excludedHosts;
        private List<String> excludedNamePatterns;

        private void ensureDefaults() {
            if (includedLevels == null || includedLevels.isEmpty()) {
                includedLevels = new ArrayList<>(List.of(RiskLevel.values()));
            }
            if (includedHosts == null) {
                includedHosts = new ArrayList<>();
            }
            if (excludedHosts == null) {
                excludedHosts = new ArrayList<>();
            }
            if (excludedNamePatterns == null) {
                excludedNamePatterns = new ArrayList<>();
            }
        }

        public FindingFilter toFindingFilter() {
            Set<RiskLevel> levels = includedLevels == null || includedLevels.isEmpty()
                ? EnumSet.allOf(RiskLevel.class)
                : EnumSet.copyOf(includedLevels);
            return FindingFilter.builder()
                .includedLevels(levels)
                .includedHosts(includedHosts == null ? List.of() : includedHosts)
                .excludedHosts(excludedHosts == null ? List.of() : excludedHosts)
                .excludedNamePatterns(excludedNamePatterns == null ? List.of() : excludedNamePatterns)
                .build();
        }
    }

    @Data
    public static class Output {
        private List<String> formats;
        private String directory = "./reports";
        private String filePrefix = "openvas_report";

        private void ensureDefaults() {
            if (formats == null || formats.isEmpty()) {
                formats = new ArrayList<>(List.of("csv"));
            }
            if (directory == null || directory.isBlank()) {
                directory = "./reports";
            }
            if (filePrefix == null || filePrefix.isBlank()) {
                filePrefix = "openvas_report";
            }
        }
    }
}
