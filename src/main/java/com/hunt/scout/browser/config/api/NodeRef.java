package com.hunt.scout.browser.config.api;

/**
 * nodeId внутри текущего документа. Живёт до следующей навигации, поэтому нигде не кэшируется.
 */
public record NodeRef(int nodeId, String selector) {}
