package com.tapelibrary.inventory.changer.fake;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.Slot;
import com.tapelibrary.inventory.changer.SlotStatus;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.MoveKind;
import com.tapelibrary.inventory.domain.SlotCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simulated changer. Never touches hardware and never fails.
 *
 * <p>It keeps an in-memory picture of the library so that {@link #status()} reflects the
 * moves it was asked to perform. A move whose source slot is empty in the simulation
 * still succeeds; it simply has nothing to carry.
 */
public class FakeChanger implements Changer {

    private static final Logger log = LoggerFactory.getLogger(FakeChanger.class);

    /** Recorded call, in invocation order. */
    public record Move(MoveKind kind, Location src, Location dst) {}

    private final Map<SlotCategory, TreeMap<Integer, String>> library = new EnumMap<>(SlotCategory.class);
    private final List<Move> history = new ArrayList<>();

    public FakeChanger() {
        this(Map.of());
    }

    /**
     * @param layout number of empty slots to simulate per category
     */
    public FakeChanger(Map<SlotCategory, Integer> layout) {
        for (SlotCategory category : SlotCategory.values()) {
            library.put(category, new TreeMap<>());
        }
        layout.forEach((category, count) -> {
            for (int addr = 0; addr < count; addr++) {
                library.get(category).put(addr, null);
            }
        });
    }

    /** Puts a cartridge into a slot, as an operator would by hand. */
    public synchronized void place(Location location, String serial) {
        library.get(location.category()).put(location.addr(), serial);
    }

    /** Empties a slot, keeping it in the layout. */
    public synchronized void clear(Location location) {
        library.get(location.category()).put(location.addr(), null);
    }

    public synchronized List<Move> history() {
        return List.copyOf(history);
    }

    @Override
    public synchronized SlotStatus status() {
        Map<SlotCategory, List<Slot>> slots = new EnumMap<>(SlotCategory.class);
        library.forEach((category, addrs) -> {
            List<Slot> list = new ArrayList<>(addrs.size());
            addrs.forEach((addr, serial) -> list.add(new Slot(addr, category, serial)));
            slots.put(category, Collections.unmodifiableList(list));
        });
        return new SlotStatus(slots);
    }

    @Override
    public void load(Location src, Location dst) {
        move(MoveKind.LOAD, src, dst);
    }

    @Override
    public void unload(Location src, Location dst) {
        move(MoveKind.UNLOAD, src, dst);
    }

    @Override
    public void transfer(Location src, Location dst) {
        move(MoveKind.TRANSFER, src, dst);
    }

    private synchronized void move(MoveKind kind, Location src, Location dst) {
        history.add(new Move(kind, src, dst));
        String serial = library.get(src.category()).put(src.addr(), null);
        library.get(dst.category()).put(dst.addr(), serial);
        log.debug("fake {}: {} -> {} ({})", kind.verb(), src, dst, serial == null ? "empty" : serial);
    }
}
