package io.trielite.exchange.dto;

/**
 * JSON form of merge settings, e.g.
 *   { "valuePolicy": "INCOMING_WINS", "logConflicts": true }
 */
public class MergeConfigJson {
    public String valuePolicy;
    public Boolean logConflicts;
}
