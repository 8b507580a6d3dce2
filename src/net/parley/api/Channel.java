package net.parley.api;

import java.util.List;

/**
 * Read-only view of a chat channel, as handed to hooks.
 */
public interface Channel {

    /**
     * The channel name; always contains a '#'.
     */
    String getName();

    /**
     * False once the last member has left.
     * A disabled channel is invisible to lookups; a new channel of the same
     * name may be created afterwards.
     */
    boolean isEnabled();

    /**
     * A snapshot of the members, in joining order.
     */
    List<UserIdentity> getMembers();

    /**
     * A snapshot of the operators, in the order they were granted.
     */
    List<UserIdentity> getOperators();

}
