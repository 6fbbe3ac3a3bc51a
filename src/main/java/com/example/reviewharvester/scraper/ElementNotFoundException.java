package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/** An expected structural element did not appear. */
public class ElementNotFoundException extends HarvestException {
    public ElementNotFoundException(String message) {
        super(FailureKind.ELEMENT_NOT_FOUND, true, message);
    }
}
