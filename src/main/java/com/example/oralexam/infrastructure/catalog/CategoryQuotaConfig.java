package com.example.oralexam.infrastructure.catalog;

import java.util.Map;

public interface CategoryQuotaConfig {

    /**
     * Category id to the number of that category's own tasks drawn per session.
     */
    Map<Long, Integer> quotas();
}
