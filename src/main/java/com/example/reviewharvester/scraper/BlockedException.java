package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/** The site answered with a CAPTCHA or "unusual traffic" interstitial. */
public class BlockedException extends HarvestException {
    public BlockedException(String url) {
        super(FailureKind.BLOCKED, false, "Blocked by site at " + url);
    }
}
