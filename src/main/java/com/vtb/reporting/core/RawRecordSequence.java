package com.vtb.reporting.core;

import org.w3c.dom.Element;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ленивая однопроходная последовательность сырых записей одного документа.
 * Записи извлекаются из XML узлов по мере обхода; повторный обход запрещен.
 */
public final class RawRecordSequence implements Iterable<RawRecord> {

    private final String source;
    private final List<Element> resultElements;
    private final Function<Element, RawRecord> extractor;
    private boolean consumed;

    RawRecordSequence(String source, List<Element> resultElements, Function<Element, RawRecord> extractor) {
        this.source = source;
        this.resultElements = resultElements;
        this.extractor = extractor;
    }

    public String getSource() {
        return source;
    }

    /**
     * Количество элементов &lt;result&gt; в документе (без их разбора)
     */
    public int size() {
        return resultElements.size();
    }

    @Override
    public Iterator<RawRecord> iterator() {
        if (consumed) {
            throw new IllegalStateException("Последовательность записей " + source + " уже прочитана");
        }
        consumed = true;
        Iterator<Element> elements = resultElements.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return elements.hasNext();
            }

            @Override
            public RawRecord next() {
                if (!elements.hasNext()) {
                    throw new NoSuchElementException();
                }
                return extractor.apply(elements.next());
            }
        };
    }

    public Stream<RawRecord> stream() {
        return StreamSupport.stream(
            Spliterators.spliterator(iterator(), resultElements.size(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
}
