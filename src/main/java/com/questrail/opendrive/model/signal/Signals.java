package com.questrail.opendrive.model.signal;

import java.util.List;

/**
 * {@code <signals>} of a road.
 */
public record Signals(List<Signal> signals, List<SignalReference> references)
{
    public Signals {
        signals = List.copyOf(signals);
        references = List.copyOf(references);
    }
}
