package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.TransferAction;

/**
 * Where consent and cancel decisions go: the engine's message channel.
 */
@FunctionalInterface
public interface ActionSink {

    void sendAction(String transferId, TransferAction action) throws EngineException;
}
