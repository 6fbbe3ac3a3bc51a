package com.example.reviewharvester.browser;

import com.example.reviewharvester.scraper.HarvestException;

/** Acquires fresh browser sessions. Callers own and must close what they open. */
@FunctionalInterface
public interface SessionFactory {
    BrowserSession open() throws HarvestException;
}
