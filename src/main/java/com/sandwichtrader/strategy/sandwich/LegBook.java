package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.model.Leg;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only arena of every leg the strategy has held.
 *
 * <p>Ids are assigned from a counter starting at 1 and never reused. Open legs are a
 * filtered view over the arena, never a second collection, so the two can't drift.
 * {@link #append} refuses a leg whose role already has an open leg: callers close the
 * old generation first.
 */
public class LegBook {

    private final List<Leg> legs = new ArrayList<>();
    private long nextId = 1;

    public long nextId() {
        return nextId;
    }

    /**
     * Appends a leg built with {@link #nextId()}.
     *
     * @throws IllegalStateException if the id is out of sequence or the role is already open
     */
    public Leg append(Leg leg) {
        if (leg.getId() != nextId) {
            throw new IllegalStateException("Leg id " + leg.getId() + " out of sequence, expected " + nextId);
        }
        if (findOpen(leg.getRole()).isPresent()) {
            throw new IllegalStateException("Role " + leg.getRole() + " already has an open leg");
        }
        legs.add(leg);
        nextId++;
        return leg;
    }

    public List<Leg> all() {
        return List.copyOf(legs);
    }

    public List<Leg> open() {
        return legs.stream().filter(Leg::isOpen).toList();
    }

    public List<Leg> closed() {
        return legs.stream().filter(leg -> !leg.isOpen()).toList();
    }

    public Optional<Leg> findOpen(LegRole role) {
        return legs.stream()
                .filter(leg -> leg.isOpen() && leg.getRole() == role)
                .findFirst();
    }

    /** Every leg ever held for a role, oldest first. */
    public List<Leg> history(LegRole role) {
        return legs.stream()
                .filter(leg -> leg.getRole() == role)
                .sorted(Comparator.comparingLong(Leg::getId))
                .toList();
    }

    public boolean isEmpty() {
        return legs.isEmpty();
    }

    public int size() {
        return legs.size();
    }
}
