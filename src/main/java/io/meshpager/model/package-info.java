/**
 * Value types flowing through the bridge: packets as received from the bus, the decoded
 * {@link io.meshpager.model.AppMessage} variants, and the persisted {@link io.meshpager.model.ProcessedRecord}.
 */
package io.meshpager.model;
