package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChangeEvent.RowSide;

import java.util.Map;

/**
 * Picks an icon either as a constant or from a field of the new row.
 */
public record IconLookup(String field, Map<String, String> icons, String defaultIcon) {

    public IconLookup {
        icons = icons == null ? Map.of() : Map.copyOf(icons);
    }

    public static IconLookup fixed(String icon) {
        return new IconLookup(null, Map.of(), icon);
    }

    public static IconLookup byField(String field, Map<String, String> icons, String defaultIcon) {
        return new IconLookup(field, icons, defaultIcon);
    }

    public String resolve(ChangeEvent event) {
        if (field == null) {
            return defaultIcon;
        }
        Object value = event.value(RowSide.NEW, field);
        if (value == null) {
            return defaultIcon;
        }
        return icons.getOrDefault(String.valueOf(value), defaultIcon);
    }
}
