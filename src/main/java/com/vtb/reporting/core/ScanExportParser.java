package com.vtb.reporting.core;

import com.vtb.reporting.errors.MalformedInputException;
import com.vtb.reporting.models.Reference;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Парсер XML экспорта OpenVAS/Greenbone.
 *
 * <p>Документ разбирается в дерево целиком (так обнаруживается некорректная разметка),
 * а записи {@code results/result} превращаются в {@link RawRecord} лениво при обходе.
 * Отсутствующие необязательные поля дают пустые значения, а не исключения.
 */
@Slf4j
public class ScanExportParser {

    private static final String RESULTS = "results";
    private static final String RESULT = "result";

    /**
     * Разобрать файл экспорта
     *
     * @throws MalformedInputException если файл не читается или не является корректным XML
     */
    public RawRecordSequence parse(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("Путь к отчету не может быть null");
        }
        log.info("Загрузка отчета сканера: {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new MalformedInputException(file.toString(), "не удалось прочитать файл (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Разобрать документ из потока
     *
     * @param source имя источника для сообщений об ошибках
     */
    public RawRecordSequence parse(InputStream in, String source) {
        if (in == null) {
            throw new IllegalArgumentException("Поток отчета не может быть null");
        }
        Document document = readDocument(in, source);
        List<Element> results = new ArrayList<>();
        NodeList candidates = document.getElementsByTagName(RESULT);
        for (int i = 0; i < candidates.getLength(); i++) {
            Element element = (Element) candidates.item(i);
            Node parent = element.getParentNode();
            // detection/result - не находка, а ссылка на результат детекта продукта
            if (parent instanceof Element && RESULTS.equals(((Element) parent).getTagName())) {
                results.add(element);
            }
        }
        log.info("Найдено {} записей <result> в {}", results.size(), source);
        return new RawRecordSequence(source, results, this::extractRecord);
    }

    private Document readDocument(InputStream in, String source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            // Защита от XXE
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new StrictErrorHandler(source));
            Document document = builder.parse(in);
            document.getDocumentElement().normalize();
            return document;
        } catch (SAXException e) {
            throw new MalformedInputException(source, e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedInputException(source, "ошибка чтения (" + e.getMessage() + ")", e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Не удалось настроить XML парсер: " + e.getMessage(), e);
        }
    }

    RawRecord extractRecord(Element result) {
        RawRecord.RawRecordBuilder builder = RawRecord.builder()
            .id(attribute(result, "id"))
            .name(childText(result, "name"))
            .owner(child(result, "owner").flatMap(owner -> childText(owner, "name")))
            .creationTime(childText(result, "creation_time"))
            .modificationTime(childText(result, "modification_time"))
            .comment(childText(result, "comment"))
            .port(childText(result, "port"))
            .scanNvtVersion(childText(result, "scan_nvt_version"))
            .threat(childText(result, "threat"))
            .severity(childText(result, "severity"))
            .description(childText(result, "description"))
            .originalThreat(childText(result, "original_threat"))
            .originalSeverity(childText(result, "original_severity"));

        child(result, "host").ifPresent(host -> builder
            .hostAddress(ownText(host))
            .assetId(child(host, "asset").flatMap(asset -> attribute(asset, "asset_id")))
            .hostname(childText(host, "hostname")));

        child(result, "qod").ifPresent(qod -> builder
            .qodValue(childText(qod, "value"))
            .qodType(childText(qod, "type")));

        child(result, "detection")
            .flatMap(detection -> child(detection, RESULT))
            .flatMap(detected -> child(detected, "details"))
            .ifPresent(details -> {
                for (Element detail : children(details, "detail")) {
                    Optional<String> name = childText(detail, "name");
                    if (name.isPresent()) {
                        builder.detectionDetail(new RawRecord.Detail(name.get(), childText(detail, "value").orElse("")));
                    }
                }
            });

        child(result, "nvt").ifPresent(nvt -> builder.nvt(Optional.of(extractNvt(nvt))));
        return builder.build();
    }

    private RawNvt extractNvt(Element nvt) {
        RawNvt.RawNvtBuilder builder = RawNvt.builder()
            .oid(attribute(nvt, "oid"))
            .type(childText(nvt, "type"))
            .name(childText(nvt, "name"))
            .family(childText(nvt, "family"))
            .cvssBase(childText(nvt, "cvss_base"));

        child(nvt, "severities").ifPresent(severities -> {
            builder.severitiesScore(attribute(severities, "score"));
            for (Element severity : children(severities, "severity")) {
                builder.severity(RawNvt.RawSeverity.builder()
                    .type(attribute(severity, "type"))
                    .origin(childText(severity, "origin"))
                    .date(childText(severity, "date"))
                    .score(childText(severity, "score"))
                    .value(childText(severity, "value"))
                    .build());
            }
        });

        childText(nvt, "tags").ifPresent(tags -> builder.tags(parseTags(tags)));

        child(nvt, "solution").ifPresent(solution -> builder
            .solutionType(attribute(solution, "type"))
            .solution(textOf(solution)));

        child(nvt, "refs").ifPresent(refs -> {
            for (Element ref : children(refs, "ref")) {
                Optional<String> id = attribute(ref, "id");
                if (id.isPresent()) {
                    builder.reference(new Reference(attribute(ref, "type").orElse(""), id.get()));
                }
            }
        });
        return builder.build();
    }

    /**
     * Теги NVT: {@code key=value|key=value}. Фрагмент без '=' сохраняется с пустым значением.
     */
    static Map<String, String> parseTags(String raw) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return tags;
        }
        for (String fragment : raw.split("\\|")) {
            if (fragment.isBlank()) {
                continue;
            }
            int eq = fragment.indexOf('=');
            if (eq < 0) {
                tags.putIfAbsent(fragment.trim(), "");
            } else {
                String key = fragment.substring(0, eq).trim();
                if (!key.isEmpty()) {
                    tags.putIfAbsent(key, fragment.substring(eq + 1).trim());
                }
            }
        }
        return tags;
    }

    /**
     * Ошибки разметки выбрасываются исключением вместо печати в stderr
     */
    private static final class StrictErrorHandler implements ErrorHandler {
        private final String source;

        private StrictErrorHandler(String source) {
            this.source = source;
        }

        @Override
        public void warning(SAXParseException e) {
            log.debug("Предупреждение XML парсера в {}: {}", source, e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    private static Optional<Element> child(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element && name.equals(((Element) node).getTagName())) {
                return Optional.of((Element) node);
            }
        }
        return Optional.empty();
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element && name.equals(((Element) node).getTagName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Optional<String> childText(Element parent, String name) {
        return child(parent, name).flatMap(ScanExportParser::textOf);
    }

    private static Optional<String> textOf(Element element) {
        return nonBlank(element.getTextContent());
    }

    /**
     * Только собственные текстовые узлы элемента: у &lt;host&gt; адрес соседствует с &lt;asset&gt; и &lt;hostname&gt;
     */
    private static Optional<String> ownText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        return nonBlank(text.toString());
    }

    private static Optional<String> attribute(Element element, String name) {
        return element.hasAttribute(name) ? nonBlank(element.getAttribute(name)) : Optional.empty();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
