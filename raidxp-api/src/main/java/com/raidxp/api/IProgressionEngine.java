package com.raidxp.api;

import com.raidxp.api.exceptions.StoreException;
import com.raidxp.api.model.Event;

public interface IProgressionEngine {

    /**
     * Applies one event as a single atomic unit of work: player upsert, event log
     * append, stat counter, XP and level, quest progress and completion.
     *
     * @param event a valid event (non-empty actor)
     * @return {@code true} if the event was applied, {@code false} if an event with
     *         the same identity had already been applied
     * @throws StoreException if the store fails; nothing of the event is visible
     */
    boolean apply(Event event);
}
