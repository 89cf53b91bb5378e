package com.gpupool.rotator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 池事件发布/订阅
 * <p>
 * 同步监听器按提交顺序回调；另提供 Reactor 事件流供 SSE 推送
 */
public class PoolEventBus {

    private static final Logger log = LoggerFactory.getLogger(PoolEventBus.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Sinks.Many<PoolEvent> sink = Sinks.many().multicast().onBackpressureBuffer(256, false);

    public Disposable subscribe(PoolEventListener listener) {
        return subscribe(PoolTopic.POOL_EVENT, listener);
    }

    public Disposable subscribe(PoolTopic topic, PoolEventListener listener) {
        Subscription subscription = new Subscription(topic, listener);
        subscriptions.add(subscription);
        return subscription;
    }

    public void publish(PoolEvent event) {
        for (Subscription s : subscriptions) {
            if (!s.topic.matches(event.type())) {
                continue;
            }
            try {
                s.listener.onEvent(event);
            } catch (RuntimeException e) {
                // 订阅方异常不影响调度
                log.warn("事件订阅方处理失败: topic={}, event={}", s.topic, event.type(), e);
            }
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("事件流推送失败: {} ({})", event.type(), result);
        }
    }

    /**
     * 实时事件流（不回放历史）
     */
    public Flux<PoolEvent> flux() {
        return sink.asFlux();
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    private final class Subscription implements Disposable {

        private final PoolTopic topic;
        private final PoolEventListener listener;
        private volatile boolean disposed;

        private Subscription(PoolTopic topic, PoolEventListener listener) {
            this.topic = topic;
            this.listener = listener;
        }

        @Override
        public void dispose() {
            disposed = true;
            subscriptions.remove(this);
        }

        @Override
        public boolean isDisposed() {
            return disposed;
        }
    }
}
