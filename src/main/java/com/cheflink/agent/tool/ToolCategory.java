package com.cheflink.agent.tool;

/** Functional domain of a tool. Used to scope which tools a run may see. */
public enum ToolCategory {
    MEAL_PLANNING,
    RECIPE_SEARCH,
    NUTRITION,
    USER_PREFERENCES
}
