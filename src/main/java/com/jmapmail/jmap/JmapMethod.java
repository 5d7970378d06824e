package com.jmapmail.jmap;

import com.jmapmail.jmap.args.MethodArgs;

/**
 * A JMAP method handler with a strongly typed argument object
 */
public interface JmapMethod<A extends MethodArgs> {

    /**
     * Method name, e.g. "Mailbox/set"
     */
    String name();

    /**
     * Capability that must be in the request's "using" list
     */
    String capability();

    Class<A> argumentType();

    Object handle(A args, InvocationContext context);
}
