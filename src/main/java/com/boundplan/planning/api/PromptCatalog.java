package com.boundplan.planning.api;

import com.boundplan.planning.model.PromptKey;
import com.boundplan.planning.model.PromptTemplate;

import java.util.Optional;

/**
 * Read-only lookup of generation templates. Exact key match only.
 */
public interface PromptCatalog {

    Optional<PromptTemplate> find(PromptKey key);
}
