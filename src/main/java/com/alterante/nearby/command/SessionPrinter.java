package com.alterante.nearby.command;

import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.observe.Milestone;
import com.alterante.nearby.observe.MilestoneSink;
import com.alterante.nearby.observe.ServiceState;
import com.alterante.nearby.observe.SessionObserver;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;

/**
 * Prints session changes and notification milestones, as text or NDJSON.
 */
class SessionPrinter implements SessionObserver, MilestoneSink {

    private final boolean json;

    SessionPrinter(boolean json) {
        this.json = json;
    }

    @Override
    public void serviceStateChanged(ServiceState state, Throwable cause) {
        if (json) {
            JsonOutput.service(state);
        } else {
            System.out.println("Service " + state.name().toLowerCase()
                    + (cause == null ? "" : ": " + cause.getMessage()));
        }
    }

    @Override
    public void outboundAdded(OutboundSession session) {
        if (json) {
            JsonOutput.endpoint(session.endpoint(), true);
        } else {
            System.out.println("Found " + session.endpoint().displayName() + " [" + session.id() + "]");
        }
    }

    @Override
    public void endpointUpdated(OutboundSession session) {
        if (json) {
            JsonOutput.endpoint(session.endpoint(), false);
        } else if (!session.endpoint().present()) {
            System.out.println(session.endpoint().displayName() + " is gone");
        }
    }

    @Override
    public void outboundChanged(OutboundSession session, TransferState previous) {
        if (json) {
            JsonOutput.outbound(session, previous);
            return;
        }
        String name = session.endpoint().displayName();
        switch (session.state()) {
            case QUEUED -> System.out.println("Queued send to " + name);
            case REQUESTED_FOR_CONSENT -> System.out.println("Waiting for " + name + " to accept (pin " + session.pinCode() + ")");
            case ONGOING_TRANSFER -> System.out.printf("Sending to %s: %.0f%%, %s%n",
                    name, session.progress() * 100, session.etaText());
            case DONE -> System.out.println(session.finishedSummary() + " to " + name);
            case FAILED -> System.out.println("Send to " + name + " failed"
                    + (session.lastEvent() == null ? "" : " (" + session.lastEvent().state().name().toLowerCase() + ")"));
            case AWAITING_CONSENT_OR_IDLE -> {
                if (previous != TransferState.AWAITING_CONSENT_OR_IDLE) {
                    System.out.println("Send to " + name + " cancelled");
                }
            }
        }
    }

    @Override
    public void outboundRemoved(OutboundSession session) {
        if (json) {
            JsonOutput.outboundRemoved(session);
        } else {
            System.out.println("Removed " + session.endpoint().displayName());
        }
    }

    @Override
    public void inboundChanged(InboundSession session) {
        if (json) {
            JsonOutput.inbound(session);
            return;
        }
        switch (session.stage()) {
            case AWAITING_CONSENT -> {
                // announced by the incoming request milestone
            }
            case IN_PROGRESS -> {
                if (session.progress() > 0) {
                    System.out.printf("Receiving from %s: %.0f%%, %s%n",
                            session.deviceName(), session.progress() * 100, session.etaText());
                }
            }
            case DECLINED -> System.out.println("Declined " + session.deviceName()
                    + (session.isTimedOut() ? " (no answer)" : ""));
            case CANCELLING -> System.out.println("Cancelling transfer from " + session.deviceName());
            case CLOSED -> {
            }
        }
    }

    @Override
    public void inboundClosed(InboundSession session) {
        if (json) {
            JsonOutput.inboundClosed(session);
        } else {
            System.out.println("Transfer from " + session.deviceName() + " closed ("
                    + session.lastEvent().state().name().toLowerCase() + ")");
        }
    }

    @Override
    public void visibilityChanged(Visibility visibility) {
        if (json) {
            JsonOutput.visibility(visibility);
        } else {
            System.out.println("Visibility: " + visibility.name().toLowerCase());
        }
    }

    @Override
    public void publish(Milestone m) {
        if (json) {
            JsonOutput.milestone(m);
            return;
        }
        switch (m.kind()) {
            case INCOMING_REQUEST -> System.out.println(m.body());
            case TRANSFER_PROGRESS -> System.out.println("Receiving from " + m.title() + "...");
            case TRANSFER_FINISHED -> System.out.println(m.body() + " from " + m.title()
                    + (m.parameter() == null ? "" : " -> " + m.parameter()));
            default -> System.out.println(m.title() + ": " + m.body());
        }
    }

    @Override
    public void withdraw(String notificationId) {
        if (json) {
            JsonOutput.withdrawn(notificationId);
        }
    }
}
