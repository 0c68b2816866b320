package com.vtb.reporting.cli;

import com.vtb.reporting.config.ReportingConfig;
import com.vtb.reporting.core.PipelineResult;
import com.vtb.reporting.core.RecordErrorPolicy;
import com.vtb.reporting.core.ReportPipeline;
import com.vtb.reporting.core.RunDiagnostics;
import com.vtb.reporting.core.SkippedRecord;
import com.vtb.reporting.analysis.ReportTotals;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.reports.ReportNaming;
import com.vtb.reporting.reports.ReportRenderer;
import com.vtb.reporting.reports.ReportRenderers;
import com.vtb.reporting.reports.ReportTable;
import com.vtb.reporting.reports.TableKind;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI команда построения отчетов из XML экспорта OpenVAS
 */
@Slf4j
@Command(
    name = "openvas-reporting",
    mixinStandardHelpOptions = true,
    version = "OpenVAS Reporting 1.0.0",
    description = """

        OpenVAS Reporting

        Построение отчетов по результатам сканирования OpenVAS

        Таблицы:
          • Уязвимости (группировка по NVT)
          • Хосты (группировка по хосту)
          • Сводка по уровням риска

        """
)
public class MainCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "1..*",
        paramLabel = "REPORT",
        description = "XML отчеты OpenVAS (один или несколько)"
    )
    private List<Path> inputs;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию из конфигурации: ./reports)"
    )
    private Path outputDir;

    @Option(
        names = {"-c", "--config"},
        description = "YAML файл конфигурации (по умолчанию reporting-config.yaml из classpath)"
    )
    private Path configFile;

    @Option(
        names = {"-f", "--format"},
        split = ",",
        description = "Формат отчета: csv, json, pdf (можно указать несколько)"
    )
    private List<String> formats;

    @Option(
        names = {"--tables"},
        split = ",",
        description = "Таблицы: vulnerability, host, summary (по умолчанию все)"
    )
    private List<String> tables;

    @Option(
        names = {"--levels"},
        split = ",",
        description = "Включаемые уровни риска: critical, high, medium, low, none"
    )
    private List<String> levels;

    @Option(
        names = {"--exclude-host"},
        description = "Исключить хост (IP или имя), можно указать несколько раз"
    )
    private List<String> excludedHosts;

    @Option(
        names = {"--prefix"},
        description = "Префикс имен файлов отчета (по умолчанию openvas_report)"
    )
    private String filePrefix;

    @Option(
        names = {"--abort-on-invalid"},
        description = "Прервать обработку на первой записи без идентификатора (по умолчанию запись пропускается)"
    )
    private boolean abortOnInvalid = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ReportingConfig config;
        List<ReportRenderer> renderers;
        try {
            config = configFile != null ? ReportingConfig.load(configFile) : ReportingConfig.load();
            applyOverrides(config);
            renderers = resolveRenderers(config.getOutput().getFormats());
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.error("Ошибка конфигурации: {}", e.getMessage(), e);
            return 1;
        }

        try {
            log.info("Обработка отчетов OpenVAS: {}", inputs);
            ReportPipeline pipeline = ReportPipeline.fromConfig(config);
            PipelineResult result = pipeline.run(inputs);

            Path outputPath = Paths.get(config.getOutput().getDirectory());
            Files.createDirectories(outputPath);
            List<Path> written = new ArrayList<>();
            for (ReportTable table : result.getReport().getTables()) {
                for (ReportRenderer renderer : renderers) {
                    Path target = ReportNaming.resolve(outputPath, config.getOutput().getFilePrefix(),
                        table.getKind(), renderer.getFileExtension());
                    renderer.render(table, target);
                    written.add(target);
                }
            }

            printSummary(result, written);
            log.info("Построение отчетов завершено");
            return 0;

        } catch (IOException e) {
            log.error("Ошибка записи отчета: {}", e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Ошибка при построении отчета: {}", e.getMessage(), e);
            return 1;
        }
    }

    /**
     * Параметры командной строки важнее значений из конфигурации
     */
    private void applyOverrides(ReportingConfig config) {
        if (outputDir != null) {
            config.getOutput().setDirectory(outputDir.toString());
        }
        if (filePrefix != null) {
            config.getOutput().setFilePrefix(filePrefix);
        }
        if (formats != null && !formats.isEmpty()) {
            config.getOutput().setFormats(new ArrayList<>(formats));
        }
        if (tables != null && !tables.isEmpty()) {
            Set<TableKind> kinds = EnumSet.noneOf(TableKind.class);
            for (String table : tables) {
                kinds.add(TableKind.fromSlug(table));
            }
            config.getTables().setByVulnerability(kinds.contains(TableKind.BY_VULNERABILITY));
            config.getTables().setByHost(kinds.contains(TableKind.BY_HOST));
            config.getTables().setSummary(kinds.contains(TableKind.SUMMARY));
        }
        if (levels != null && !levels.isEmpty()) {
            Set<RiskLevel> parsed = new LinkedHashSet<>();
            for (String level : levels) {
                parsed.add(RiskLevel.fromName(level));
            }
            config.getFilter().setIncludedLevels(new ArrayList<>(parsed));
        }
        if (excludedHosts != null && !excludedHosts.isEmpty()) {
            List<String> merged = new ArrayList<>(config.getFilter().getExcludedHosts());
            merged.addAll(excludedHosts);
            config.getFilter().setExcludedHosts(merged);
        }
        if (abortOnInvalid) {
            config.setErrorPolicy(RecordErrorPolicy.ABORT);
        }
    }

    private static List<ReportRenderer> resolveRenderers(List<String> names) {
        List<ReportRenderer> renderers = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            ReportRenderer renderer = ReportRenderers.forFormat(name);
            if (seen.add(renderer.getFileExtension())) {
                renderers.add(renderer);
            }
        }
        return renderers;
    }

    private void printSummary(PipelineResult result, List<Path> written) {
        RunDiagnostics diagnostics = result.getDiagnostics();
        System.out.println("\n" + "=".repeat(80));
        System.out.println("OPENVAS REPORT");
        System.out.println("=".repeat(80));
        System.out.println("Документов: " + diagnostics.getDocuments());
        System.out.println("Записей:    " + diagnostics.getParsedRecords());
        System.out.println("Находок:    " + result.getFindings().size()
            + " (отфильтровано: " + diagnostics.getFilteredFindings() + ")");
        System.out.println("Хостов:     " + diagnostics.getDistinctHosts());
        System.out.println("NVT:        " + diagnostics.getDistinctVulnerabilities());

        result.getByVulnerability().ifPresent(aggregation -> {
            ReportTotals totals = aggregation.getTotals();
            System.out.println();
            for (RiskLevel level : RiskLevel.values()) {
                System.out.printf("%-9s %d%n", level.name() + ":", totals.countOf(level));
            }
        });

        if (diagnostics.getSkippedCount() > 0) {
            System.out.println();
            System.out.println("Пропущено записей: " + diagnostics.getSkippedCount());
            for (SkippedRecord skipped : diagnostics.getSkippedRecords()) {
                System.out.println("   - " + skipped.getReason());
            }
        }

        System.out.println();
        System.out.println("Отчеты сохранены:");
        written.forEach(path -> System.out.println("   " + path));
        System.out.println("=".repeat(80));
    }
}
