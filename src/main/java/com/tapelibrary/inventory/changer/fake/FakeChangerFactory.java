package com.tapelibrary.inventory.changer.fake;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.ChangerFactory;
import com.tapelibrary.inventory.domain.SlotCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Factory for {@link FakeChanger}. Accepts any options; the optional
 * {@code <category>-slots} keys (e.g. {@code storage-slots: 20}) size the simulated library.
 * Values that are not a non-negative number are logged and ignored.
 */
public class FakeChangerFactory implements ChangerFactory {

    private static final Logger log = LoggerFactory.getLogger(FakeChangerFactory.class);

    public static final String NAME = "fake";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Changer create(Map<String, String> options) {
        Map<SlotCategory, Integer> layout = new EnumMap<>(SlotCategory.class);
        for (SlotCategory category : SlotCategory.values()) {
            String key = category.label() + "-slots";
            String value = options.get(key);
            if (value == null) {
                continue;
            }
            Integer count = parseCount(value);
            if (count == null) {
                log.warn("Ignoring fake changer option {}={}: expected a non-negative number", key, value);
                continue;
            }
            layout.put(category, count);
        }
        return new FakeChanger(layout);
    }

    private static Integer parseCount(String value) {
        try {
            int count = Integer.parseInt(value.trim());
            return count < 0 ? null : count;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
