package com.cheflink.agent.kitchen;

import java.time.LocalDate;
import java.util.List;

public interface MealPlanStore {

    /**
     * Creates the slot or replaces what was planned there.
     *
     * @return true if an existing entry was replaced
     */
    boolean upsert(MealPlanEntry entry);

    /**
     * @return entries between both dates inclusive, ordered by date then meal type
     */
    List<MealPlanEntry> findForUser(String userId, LocalDate from, LocalDate to);
}
