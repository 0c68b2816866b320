package com.vtb.reporting.models;

/**
 * Сущность, по которой можно группировать находки (уязвимость или хост)
 */
public interface GroupKey {

    /**
     * Строковая идентичность ключа: oid уязвимости или ключ хоста
     */
    String identity();

    /**
     * Имя для естественной сортировки групп (название уязвимости / имя хоста)
     */
    String sortName();
}
