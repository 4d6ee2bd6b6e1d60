package com.flagship.subscription_billing.support;

import com.flagship.subscription_billing.charge.ChargeExecutor;
import com.flagship.subscription_billing.charge.ChargeIndeterminateException;
import com.flagship.subscription_billing.charge.ChargeRequest;
import com.flagship.subscription_billing.charge.ChargeResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Gateway double. Answers are scripted per subscription and consumed in
 * order; once a script runs out, or for subscriptions without one, the
 * default answer applies. Thread-safe.
 */
public class ScriptedChargeExecutor implements ChargeExecutor {

    public enum Answer {
        APPROVE,
        DECLINE,
        TIMEOUT
    }

    private final Map<UUID, Deque<Answer>> scripts = new ConcurrentHashMap<>();
    private final List<ChargeRequest> requests = new ArrayList<>();
    private volatile Answer defaultAnswer = Answer.APPROVE;
    private volatile Consumer<ChargeRequest> onCharge = request -> { };

    public void setDefaultAnswer(Answer answer) {
        this.defaultAnswer = answer;
    }

    public void script(UUID subscriptionId, Answer... answers) {
        Deque<Answer> script = new ArrayDeque<>(List.of(answers));
        scripts.put(subscriptionId, script);
    }

    /** Runs before each answer, on the calling worker thread. */
    public void onCharge(Consumer<ChargeRequest> hook) {
        this.onCharge = hook;
    }

    public synchronized List<ChargeRequest> requests() {
        return new ArrayList<>(requests);
    }

    public synchronized long requestsFor(UUID subscriptionId) {
        return requests.stream().filter(r -> r.getSubscriptionId().equals(subscriptionId)).count();
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        synchronized (this) {
            requests.add(request);
        }
        onCharge.accept(request);

        Answer answer = nextAnswer(request.getSubscriptionId());
        return switch (answer) {
            case APPROVE -> ChargeResult.succeeded("txn_" + request.getIdempotencyKey());
            case DECLINE -> ChargeResult.declined(null, "card_declined");
            case TIMEOUT -> throw new ChargeIndeterminateException("gateway timeout");
        };
    }

    private Answer nextAnswer(UUID subscriptionId) {
        Deque<Answer> script = scripts.get(subscriptionId);
        if (script != null) {
            synchronized (script) {
                Answer next = script.poll();
                if (next != null) {
                    return next;
                }
            }
        }
        return defaultAnswer;
    }
}
