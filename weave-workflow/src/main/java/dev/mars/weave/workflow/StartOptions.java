/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.weave.workflow;

/**
 * Per-start options: an optional caller-chosen instance id and owner metadata.
 */
public class StartOptions {

    private final String instanceId;
    private final String userId;
    private final String workspace;

    private StartOptions(String instanceId, String userId, String workspace) {
        this.instanceId = instanceId;
        this.userId = userId;
        this.workspace = workspace;
    }

    public static StartOptions defaults() {
        return new StartOptions(null, null, null);
    }

    /**
     * @return the requested instance id, or null to have one generated
     */
    public String getInstanceId() {
        return instanceId;
    }

    public String getUserId() {
        return userId;
    }

    public String getWorkspace() {
        return workspace;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "StartOptions{" +
               "instanceId='" + instanceId + '\'' +
               ", userId='" + userId + '\'' +
               ", workspace='" + workspace + '\'' +
               '}';
    }

    /**
     * Builder for StartOptions.
     */
    public static class Builder {
        private String instanceId;
        private String userId;
        private String workspace;

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder workspace(String workspace) {
            this.workspace = workspace;
            return this;
        }

        public StartOptions build() {
            return new StartOptions(instanceId, userId, workspace);
        }
    }
}
