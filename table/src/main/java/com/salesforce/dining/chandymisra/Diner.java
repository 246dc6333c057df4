/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.chandymisra;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.dining.Phase;
import com.salesforce.dining.StateCorruptionException;
import com.salesforce.dining.chandymisra.Message.Delivery;
import com.salesforce.dining.chandymisra.Message.Hungry;
import com.salesforce.dining.chandymisra.Message.Request;
import com.salesforce.dining.chandymisra.Message.Retract;
import com.salesforce.dining.chandymisra.Message.Sated;
import com.salesforce.dining.utils.Channel;
import com.salesforce.dining.utils.ChannelMultiplexer;

/**
 * The protocol state of one philosopher. Tokens, outstanding requests, deferred requests and the phase are touched
 * only on the diner's own consumer thread; diners share nothing and interact only through their links.
 * <p>
 * There is one inbound link per shared fork, so each directed neighbour link carries the messages of exactly one fork
 * in FIFO order.
 */
class Diner {
    static final int LEFT  = 0;
    static final int RIGHT = 1;

    private static final Logger log = LoggerFactory.getLogger(Diner.class);

    private final Channel<Message>             control;
    private final Deque<Request>               deferred  = new ArrayDeque<>();
    private final int[]                        forks;
    private final Token[]                      held      = new Token[2];
    private final int                          id;
    private final ChannelMultiplexer<Message>  inbox;
    private final Channel<Message>[]           inbound;
    private final ForkListener                 listener;
    private final int[]                        neighbours;
    private final Consumer<Throwable>          onFailure;
    @SuppressWarnings("unchecked")
    private final Channel<Message>[]           outbound  = new Channel[2];
    private Phase                              phase     = Phase.THINKING;
    private final boolean[]                    requested = new boolean[2];
    private CompletableFuture<Void>            seated;

    @SuppressWarnings("unchecked")
    Diner(int id, int seats, int linkCapacity, int controlCapacity, ForkListener listener,
          Consumer<Throwable> onFailure) {
        this.id = id;
        this.listener = listener;
        this.onFailure = onFailure;
        forks = new int[] { id, (id + 1) % seats };
        neighbours = new int[] { (id + seats - 1) % seats, (id + 1) % seats };
        inbox = new ChannelMultiplexer<>("diner-" + id);
        control = inbox.open("control-" + id, controlCapacity);
        inbound = new Channel[] { inbox.open("fork-" + forks[LEFT] + "-to-" + id, linkCapacity),
                                  inbox.open("fork-" + forks[RIGHT] + "-to-" + id, linkCapacity) };

        // the fork shared by two neighbours starts with the lower indexed one
        if (id < neighbours[LEFT]) {
            held[LEFT] = new Token(forks[LEFT]);
        }
        if (id < neighbours[RIGHT]) {
            held[RIGHT] = new Token(forks[RIGHT]);
        }
    }

    @Override
    public String toString() {
        return "Diner[" + id + " " + phase + " left: " + held[LEFT] + " right: " + held[RIGHT] + "]";
    }

    void close() {
        inbox.close();
    }

    /**
     * Wire the outbound links: the left fork is shared with the left neighbour's right hand, and vice versa
     */
    void connect(Diner leftNeighbour, Diner rightNeighbour) {
        outbound[LEFT] = leftNeighbour.inbound[RIGHT];
        outbound[RIGHT] = rightNeighbour.inbound[LEFT];
    }

    Channel<Message> control() {
        return control;
    }

    void start() {
        inbox.consumeEach(this::accept);
    }

    private void accept(Message message) {
        log.trace("Diner: {} received: {}", id, message);
        try {
            if (message instanceof Request request) {
                request(request);
            } else if (message instanceof Delivery delivery) {
                delivery(delivery);
            } else if (message instanceof Hungry hungry) {
                hungry(hungry.seated());
            } else if (message instanceof Sated) {
                sated();
            } else if (message instanceof Retract) {
                retract();
            } else {
                throw new IllegalArgumentException("Unknown message: " + message);
            }
        } catch (Throwable t) {
            log.error("Diner: {} failed processing: {}", id, message, t);
            final var attempt = seated;
            seated = null;
            if (attempt != null) {
                attempt.completeExceptionally(new StateCorruptionException("Diner: " + id + " failed", t));
            }
            onFailure.accept(t);
        }
    }

    private void delivery(Delivery delivery) {
        final var token = delivery.token();
        final int side = side(token.fork());
        if (held[side] != null) {
            throw new StateCorruptionException("Diner: " + id + " received: " + token + " from: " + delivery.from()
            + " while holding: " + held[side]);
        }
        held[side] = token;
        requested[side] = false;
        listener.delivered(token.fork(), delivery.from(), id, token.isDirty());
        switch (phase) {
        case HUNGRY:
            tryEat();
            break;
        case THINKING:
            // arrived after the attempt was abandoned, no claim on it
            token.soil();
            honourDeferred();
            break;
        default:
            throw new StateCorruptionException("Diner: " + id + " received: " + token + " while eating");
        }
    }

    private void dirty() {
        for (Token token : held) {
            if (token != null) {
                token.soil();
                listener.dirtied(token.fork(), id);
            }
        }
    }

    private void honourDeferred() {
        for (Iterator<Request> requests = deferred.iterator(); requests.hasNext();) {
            final var request = requests.next();
            final int side = side(request.fork());
            if (held[side] != null && held[side].isDirty()) {
                requests.remove();
                surrender(side);
            }
        }
    }

    private void hungry(CompletableFuture<Void> seated) {
        if (phase != Phase.THINKING) {
            throw new StateCorruptionException("Diner: " + id + " asked to eat while: " + phase);
        }
        phase = Phase.HUNGRY;
        this.seated = seated;
        requestMissing();
        tryEat();
    }

    private void request(Request request) {
        final int side = side(request.fork());
        final var token = held[side];
        if (token != null && token.isDirty() && phase != Phase.EATING) {
            surrender(side);
            if (phase == Phase.HUNGRY) {
                requestMissing();
            }
            return;
        }
        if (deferred.stream().noneMatch(r -> r.fork() == request.fork())) {
            deferred.addLast(request);
        }
        listener.deferred(request.fork(), id, request.from());
        log.trace("Diner: {} deferred: {}", id, request);
    }

    private void requestMissing() {
        for (int side : new int[] { LEFT, RIGHT }) {
            if (held[side] == null && !requested[side]) {
                requested[side] = true;
                send(side, new Request(id, forks[side]));
            }
        }
    }

    private void retract() {
        switch (phase) {
        case EATING:
            sated();
            break;
        case HUNGRY:
            phase = Phase.THINKING;
            seated = null;
            dirty();
            honourDeferred();
            break;
        default:
            log.trace("Diner: {} nothing to retract", id);
        }
    }

    private void sated() {
        if (phase != Phase.EATING) {
            throw new StateCorruptionException("Diner: " + id + " finished eating while: " + phase);
        }
        phase = Phase.THINKING;
        seated = null;
        dirty();
        honourDeferred();
    }

    private void send(int side, Message message) {
        final var link = outbound[side];
        if (!link.offer(message)) {
            if (link.isClosed()) {
                log.debug("Diner: {} link: {} closed, dropping: {}", id, link.label(), message);
                return;
            }
            throw new StateCorruptionException("Diner: " + id + " link: " + link.label() + " overflow sending: "
            + message);
        }
    }

    private int side(int fork) {
        if (fork == forks[LEFT]) {
            return LEFT;
        }
        if (fork == forks[RIGHT]) {
            return RIGHT;
        }
        throw new StateCorruptionException("Diner: " + id + " does not share fork: " + fork);
    }

    private void surrender(int side) {
        final var token = held[side];
        held[side] = null;
        token.clean();
        log.trace("Diner: {} surrendering: {} to: {}", id, token, neighbours[side]);
        send(side, new Delivery(id, token));
    }

    private void tryEat() {
        if (phase != Phase.HUNGRY || held[LEFT] == null || held[RIGHT] == null) {
            return;
        }
        phase = Phase.EATING;
        listener.seated(id);
        log.trace("Diner: {} seated with: {} {}", id, held[LEFT], held[RIGHT]);
        seated.complete(null);
    }
}
