package com.raidxp.api;

import com.raidxp.api.model.Event;

import java.util.List;

public interface IEventExtractor {

    /**
     * Extracts the events described by one raw log line.
     *
     * <p>Never throws: lines that match no rule, or whose matches carry no usable
     * actor, yield an empty list. Events come back in derivation order with
     * duplicates removed.
     *
     * @param line raw log line, without its line terminator
     * @return extracted events (possibly empty, never null)
     */
    List<Event> parse(String line);
}
