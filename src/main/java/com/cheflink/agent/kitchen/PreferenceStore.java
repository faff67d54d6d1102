package com.cheflink.agent.kitchen;

import java.util.Map;

/**
 * Free-form dietary preferences per user (allergies, diet, dislikes...).
 */
public interface PreferenceStore {

    Map<String, Object> get(String userId);

    /**
     * Shallow merge: given keys overwrite, other keys are kept.
     *
     * @return the preferences after the merge
     */
    Map<String, Object> merge(String userId, Map<String, Object> updates);
}
