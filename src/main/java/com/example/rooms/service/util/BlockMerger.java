package com.example.rooms.service.util;

import com.example.rooms.model.Block;
import com.example.rooms.model.Booking;
import com.example.rooms.model.TimePoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Folds a day's bookings into contiguous busy blocks.
 */
@Slf4j
public final class BlockMerger {

    private BlockMerger() {
    }

    /**
     * Bookings where one ends exactly when the next starts end up in the same block.
     * Any gap closes the block. Overlapping input should not reach this point, but if it
     * does the booking is folded in as well so the returned blocks never overlap.
     *
     * @return blocks sorted by start, mutually non-overlapping
     */
    public static List<Block> mergeBlocks(Collection<Booking> bookings) {
        if (bookings == null || bookings.isEmpty()) {
            return List.of();
        }

        List<Booking> sorted = bookings.stream()
                .sorted(Booking.BY_START)
                .toList();

        List<Block> blocks = new ArrayList<>();
        List<Booking> run = new ArrayList<>();
        TimePoint blockStart = null;
        TimePoint blockEnd = null;

        for (Booking booking : sorted) {
            if (blockEnd != null && !booking.start().isAfter(blockEnd)) {
                if (booking.start().isBefore(blockEnd)) {
                    log.warn("Overlapping bookings {} and block ending {}, folding into one block", booking.id(), blockEnd);
                }
                run.add(booking);
                blockEnd = NaiveTime.max(blockEnd, booking.end());
                continue;
            }
            if (blockEnd != null) {
                blocks.add(new Block(blockStart, blockEnd, run));
                run = new ArrayList<>();
            }
            run.add(booking);
            blockStart = booking.start();
            blockEnd = booking.end();
        }
        blocks.add(new Block(blockStart, blockEnd, run));

        log.debug("Merged {} bookings into {} blocks", sorted.size(), blocks.size());
        return List.copyOf(blocks);
    }

    /** The block the given booking belongs to, when the booking is part of {@code bookings}. */
    public static Optional<Block> blockContaining(Booking booking, Collection<Booking> bookings) {
        return mergeBlocks(bookings).stream()
                .filter(block -> block.toInterval().contains(booking.start()))
                .findFirst();
    }

    /** End of the latest-ending booking, i.e. when the room is free for the rest of the day. */
    public static Optional<TimePoint> lastBusyEnd(Collection<Booking> bookings) {
        if (bookings == null) {
            return Optional.empty();
        }
        return bookings.stream()
                .map(Booking::end)
                .max(TimePoint::compareTo);
    }
}
