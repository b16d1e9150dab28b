package com.cascade.action;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The "; "-separated tag list format of System.Tags.
 */
public final class TagList {

    public static final String SEPARATOR = "; ";

    private TagList() {
    }

    /**
     * Split a tag field value. Null or empty yields an empty list.
     */
    public static List<String> parse(String value) {
        if (value == null || value.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(value.split(SEPARATOR, -1)));
    }

    public static String join(List<String> tags) {
        return String.join(SEPARATOR, tags);
    }
}
