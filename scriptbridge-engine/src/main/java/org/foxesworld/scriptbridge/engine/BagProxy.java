package org.foxesworld.scriptbridge.engine;

import org.foxesworld.scriptbridge.core.module.PropertyBag;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.Objects;

/**
 * Exposes a {@link PropertyBag} to script as an object with dynamic members.
 */
final class BagProxy implements ProxyObject {

    private final PropertyBag bag;
    private final GraalModuleEngine engine;

    BagProxy(PropertyBag bag, GraalModuleEngine engine) {
        this.bag = Objects.requireNonNull(bag, "bag");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    PropertyBag bag() {
        return bag;
    }

    @Override
    public Object getMember(String key) {
        return bag.get(key);
    }

    @Override
    public Object getMemberKeys() {
        return ProxyArray.fromArray(bag.keys().toArray());
    }

    @Override
    public boolean hasMember(String key) {
        return bag.has(key);
    }

    @Override
    public void putMember(String key, Value value) {
        bag.put(key, engine.fromGuest(value));
    }
}
