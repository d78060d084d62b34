/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.slquery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides version information for the SLQuery Java SDK.
 *
 * <p>Version information is read from a properties file generated at build time.
 */
public final class SlQueryVersion {

    private static final Logger log = LoggerFactory.getLogger(SlQueryVersion.class);
    private static final String PROPERTIES_FILE = "/slquery-version.properties";
    private static final String UNKNOWN = "unknown";

    private static final SlQueryVersion INSTANCE = load();

    private final String version;
    private final String buildTime;

    private SlQueryVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
    }

    private static SlQueryVersion load() {
        String version = UNKNOWN;
        String buildTime = UNKNOWN;

        try (InputStream is = SlQueryVersion.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                version = props.getProperty("version", UNKNOWN);
                buildTime = props.getProperty("buildTime", UNKNOWN);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", PROPERTIES_FILE, e);
        }
        return new SlQueryVersion(version, buildTime);
    }

    public static SlQueryVersion getInstance() {
        return INSTANCE;
    }

    /**
     * Gets the SDK version string.
     *
     * @return the version string (e.g., "0.1.0")
     */
    public String getVersion() {
        return version;
    }

    /**
     * Gets the build timestamp.
     *
     * @return the build time as ISO-8601 string, or "unknown" if not available
     */
    public String getBuildTime() {
        return buildTime;
    }

    @Override
    public String toString() {
        if (UNKNOWN.equals(buildTime)) {
            return "SLQuery Java SDK " + version;
        }
        return "SLQuery Java SDK " + version + " (built: " + buildTime + ")";
    }
}
