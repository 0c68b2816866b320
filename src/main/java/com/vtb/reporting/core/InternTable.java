package com.vtb.reporting.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Таблица интернирования одного запуска: по ключу хранится единственный экземпляр сущности.
 * Создается заново для каждого запуска и не разделяется между запусками.
 */
public final class InternTable<K, V> {

    private final Map<K, V> instances = new LinkedHashMap<>();

    /**
     * Вернуть уже известный экземпляр или создать и запомнить новый
     */
    public V intern(K key, Function<? super K, ? extends V> factory) {
        if (key == null) {
            throw new IllegalArgumentException("Ключ интернирования не может быть null");
        }
        V existing = instances.get(key);
        if (existing != null) {
            return existing;
        }
        V created = factory.apply(key);
        if (created == null) {
            throw new IllegalStateException("Фабрика вернула null для ключа " + key);
        }
        instances.put(key, created);
        return created;
    }

    public Optional<V> find(K key) {
        return Optional.ofNullable(instances.get(key));
    }

    public boolean contains(K key) {
        return instances.containsKey(key);
    }

    public int size() {
        return instances.size();
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(instances.values());
    }
}
