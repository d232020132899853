package com.verisign.vscc.trie.utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verisign.vscc.trie.TrieEntries;
import com.verisign.vscc.trie.TrieEntry;


public class TrieJson {

    public static final String FIELD_PREFIX = "prefix";
    public static final String FIELD_RESULTS = "results";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_VALUE = "value";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static List<Map<String, Object>> toList(TrieEntries<?> entries) {
        final List<Map<String, Object>> list = new ArrayList<>(entries.size());
        for (TrieEntry<?> entry : entries) {
            final Map<String, Object> o = new LinkedHashMap<>();
            o.put(FIELD_KEY, entry.getKey());
            o.put(FIELD_VALUE, entry.getValue());
            list.add(o);
        }
        return list;
    }

    public static String toJson(String prefix, TrieEntries<?> entries) throws IOException {
        final Map<String, Object> o = new LinkedHashMap<>();
        o.put(FIELD_PREFIX, prefix);
        o.put(FIELD_RESULTS, toList(entries));
        return mapper.writeValueAsString(o);
    }

    public static Map<String, Object> toMap(String value) throws IOException {
        final Map<String, Object> o = mapper.readValue(value, Map.class);
        return o;
    }
}
