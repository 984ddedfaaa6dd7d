/*
 * Resource.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of tracery, a causally-correct telemetry pipeline.
 *
 * tracery is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * tracery is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with tracery.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.tracery;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static identity of the process emitting telemetry.
 * Built once from {@link TelemetryConfig} and attached to every span batch
 * and metric exposition; there is no way to change it afterwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Resource {

    public static final String SERVICE_NAME = "service.name";
    public static final String SERVICE_VERSION = "service.version";
    public static final String SERVICE_NAMESPACE = "service.namespace";
    public static final String SERVICE_INSTANCE_ID = "service.instance.id";
    public static final String DEPLOYMENT_ENVIRONMENT = "deployment.environment";

    private final Map<String, String> attributes;

    private Resource(Map<String, String> attributes) {
        this.attributes = Collections.unmodifiableMap(new TreeMap<String, String>(attributes));
    }

    /**
     * Creates a resource from a mapping of identifying attributes.
     * The mapping must name the service.
     *
     * @param attributes the attributes, copied
     * @return the resource
     */
    public static Resource of(Map<String, String> attributes) {
        if (attributes == null || attributes.get(SERVICE_NAME) == null) {
            throw new IllegalArgumentException(SERVICE_NAME + " is required");
        }
        return new Resource(attributes);
    }

    /**
     * Creates the resource described by a configuration.
     */
    static Resource fromConfig(TelemetryConfig config) {
        Map<String, String> attrs = new TreeMap<String, String>(config.getResourceAttributes());
        attrs.put(SERVICE_NAME, config.getServiceName());
        putIfSet(attrs, SERVICE_VERSION, config.getServiceVersion());
        putIfSet(attrs, SERVICE_NAMESPACE, config.getServiceNamespace());
        putIfSet(attrs, SERVICE_INSTANCE_ID, config.getServiceInstanceId());
        putIfSet(attrs, DEPLOYMENT_ENVIRONMENT, config.getDeploymentEnvironment());
        return of(attrs);
    }

    private static void putIfSet(Map<String, String> attrs, String key, String value) {
        if (value != null && !value.isEmpty()) {
            attrs.put(key, value);
        }
    }

    public String getServiceName() {
        return attributes.get(SERVICE_NAME);
    }

    /**
     * Returns the value of an attribute, or null.
     */
    public String get(String key) {
        return attributes.get(key);
    }

    /**
     * Returns an unmodifiable, key-ordered view of all attributes.
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "Resource" + attributes;
    }

}
