/*
 * Copyright 2016 Midokura SARL
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

package org.midonet.ovsport;

/**
 * Base class of every error raised while provisioning an OVS internal port
 * and configuring it inside a network namespace. Each subclass carries one
 * {@link Code}, and the message always starts with the code's label so a
 * single log line tells which stage failed.
 */
public abstract class OvsPortException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The enumeration of error kinds.
     */
    public enum Code {
        CONFIGURATION_INVALID("Invalid configuration: "),
        CONNECTION_FAILED("OVSDB connection failed: "),
        TRANSACTION_FAILED("OVSDB transaction failed: "),
        DEVICE_OPERATION_FAILED("Device operation failed: ");

        private final String label;

        Code(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Code code;

    protected OvsPortException(Code code, String message) {
        super(code.label() + message);
        this.code = code;
    }

    protected OvsPortException(Code code, String message, Throwable cause) {
        super(code.label() + message, cause);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    /**
     * @see Code#CONFIGURATION_INVALID
     */
    public static class ConfigurationInvalidException extends OvsPortException {
        private static final long serialVersionUID = 1L;

        public ConfigurationInvalidException(String message) {
            super(Code.CONFIGURATION_INVALID, message);
        }
    }

    /**
     * @see Code#CONNECTION_FAILED
     */
    public static class ConnectionFailedException extends OvsPortException {
        private static final long serialVersionUID = 1L;

        public ConnectionFailedException(String message) {
            super(Code.CONNECTION_FAILED, message);
        }

        public ConnectionFailedException(String message, Throwable cause) {
            super(Code.CONNECTION_FAILED, message, cause);
        }
    }

    /**
     * Raised when a transaction reply reports an error on any operation,
     * when the reply is too short, or when a conditional mutation matched
     * no row. The server's own error and details strings are kept.
     *
     * @see Code#TRANSACTION_FAILED
     */
    public static class TransactionFailedException extends OvsPortException {
        private static final long serialVersionUID = 1L;

        /** Index of the failing operation, or -1 if not tied to one. */
        private final int opIndex;
        /** Short description of the failing operation, may be null. */
        private final String operation;
        private final String error;
        private final String details;

        public TransactionFailedException(String message) {
            this(message, -1, null, null, null);
        }

        public TransactionFailedException(String message, int opIndex,
                                          String operation, String error,
                                          String details) {
            super(Code.TRANSACTION_FAILED, message);
            this.opIndex = opIndex;
            this.operation = operation;
            this.error = error;
            this.details = details;
        }

        public int getOpIndex() {
            return opIndex;
        }

        public String getOperation() {
            return operation;
        }

        public String getError() {
            return error;
        }

        public String getDetails() {
            return details;
        }
    }

    /**
     * A single interface-control step failed.
     *
     * @see Code#DEVICE_OPERATION_FAILED
     */
    public static class DeviceOperationFailedException extends OvsPortException {
        private static final long serialVersionUID = 1L;

        private final String device;
        private final String step;
        private final String target;

        public DeviceOperationFailedException(String device, String step,
                                              String target, Throwable cause) {
            super(Code.DEVICE_OPERATION_FAILED,
                  describe(device, step, target, cause), cause);
            this.device = device;
            this.step = step;
            this.target = target;
        }

        public DeviceOperationFailedException(String device, String step,
                                              String target, String reason) {
            super(Code.DEVICE_OPERATION_FAILED,
                  describe(device, step, target, null) + ": " + reason);
            this.device = device;
            this.step = step;
            this.target = target;
        }

        private static String describe(String device, String step,
                                       String target, Throwable cause) {
            StringBuilder sb = new StringBuilder();
            sb.append(step).append(" on ").append(device);
            if (target != null) {
                sb.append(" (").append(target).append(')');
            }
            if (cause != null && cause.getMessage() != null) {
                sb.append(": ").append(cause.getMessage());
            }
            return sb.toString();
        }

        public String getDevice() {
            return device;
        }

        public String getStep() {
            return step;
        }

        /** The value the step tried to apply, may be null. */
        public String getTarget() {
            return target;
        }
    }
}
