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

package org.midonet.ovsport.tools;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import com.typesafe.config.ConfigException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.ovsport.OvsPortException;
import org.midonet.ovsport.config.OvsPortConfig;
import org.midonet.ovsport.guice.OvsPortModule;
import org.midonet.ovsport.netns.NetworkConfig;
import org.midonet.ovsport.netns.NetworkState;
import org.midonet.ovsport.netns.NetworkStrategy;
import org.midonet.ovsport.port.PortProvisioner;

/**
 * This class implements the 'ovsport-ctl' command line tool, which gives a
 * network namespace an OVS internal port in two steps: --create in the
 * parent namespace, then --initialize inside the target namespace.
 */
public class OvsPortCtl {

    private static final Logger log = LoggerFactory.getLogger(OvsPortCtl.class);

    enum RetCode {
        UNKNOWN_ERROR(-1, "Command failed"),
        SUCCESS(0, "Command succeeded"),
        BAD_COMMAND(1, "Invalid command"),
        CONFIGURATION_INVALID(2, "Invalid configuration"),
        CONNECTION_FAILED(3, "Cannot reach the switch database"),
        TRANSACTION_FAILED(4, "Switch database transaction failed"),
        DEVICE_OPERATION_FAILED(5, "Device configuration failed");

        private final int code;
        private final String msg;

        RetCode(int code, String msg) {
            this.code = code;
            this.msg = msg;
        }

        public int getCode() {
            return code;
        }

        public String getMessage() {
            return msg;
        }

        static RetCode of(OvsPortException e) {
            switch (e.getCode()) {
                case CONFIGURATION_INVALID:
                    return CONFIGURATION_INVALID;
                case CONNECTION_FAILED:
                    return CONNECTION_FAILED;
                case TRANSACTION_FAILED:
                    return TRANSACTION_FAILED;
                case DEVICE_OPERATION_FAILED:
                    return DEVICE_OPERATION_FAILED;
                default:
                    return UNKNOWN_ERROR;
            }
        }
    }

    private final NetworkStrategy strategy;
    private final PrintStream out;
    private final PrintStream err;

    public OvsPortCtl(NetworkStrategy strategy, PrintStream out,
                      PrintStream err) {
        this.strategy = strategy;
        this.out = out;
        this.err = err;
    }

    static Options options() {
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("create")
            .desc("Create a port on a bridge and move it to the namespace "
                  + "of --pid").build());
        commands.addOption(Option.builder().longOpt("initialize")
            .desc("Configure the moved port from inside the namespace")
            .build());
        commands.setRequired(true);

        Options options = new Options();
        options.addOptionGroup(commands);
        options.addOption(argOption("bridge", "Bridge to attach the port to"));
        options.addOption(argOption("prefix", "Prefix of the port name"));
        options.addOption(argOption("pid", "Process owning the namespace"));
        options.addOption(argOption("mtu", "MTU of the device"));
        options.addOption(argOption("port", "Port created by --create"));
        options.addOption(argOption("address", "Address, in CIDR notation"));
        options.addOption(argOption("mac", "MAC address of the device"));
        options.addOption(argOption("ipv6-address",
                                    "IPv6 address, in CIDR notation"));
        options.addOption(argOption("gateway", "Default gateway"));
        options.addOption(argOption("ipv6-gateway", "IPv6 default gateway"));
        options.addOption(argOption("state",
                                    "File passing the port name between the "
                                    + "two steps"));
        options.addOption(argOption("config", "Configuration file"));
        return options;
    }

    private static Option argOption(String name, String description) {
        return Option.builder().longOpt(name).hasArg().argName(name)
            .desc(description).build();
    }

    static CommandLine parse(String... args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        return parser.parse(options(), args);
    }

    /**
     * Parses the arguments and runs the selected step.
     */
    public RetCode run(String... args) {
        CommandLine cl;
        try {
            cl = parse(args);
        } catch (ParseException e) {
            err.println("Error with the options: " + e.getMessage());
            return RetCode.BAD_COMMAND;
        }
        return execute(cl);
    }

    RetCode execute(CommandLine cl) {
        try {
            NetworkConfig config = networkConfig(cl);
            if (cl.hasOption("create")) {
                return create(cl, config);
            } else {
                return initialize(cl, config);
            }
        } catch (ParseException e) {
            err.println("Error with the options: " + e.getMessage());
            return RetCode.BAD_COMMAND;
        } catch (OvsPortException e) {
            log.error("{}", e.getMessage(), e);
            err.println(e.getMessage());
            return RetCode.of(e);
        } catch (IOException e) {
            log.error("Cannot access the state file", e);
            err.println(RetCode.UNKNOWN_ERROR.getMessage() + ": "
                        + e.getMessage());
            return RetCode.UNKNOWN_ERROR;
        }
    }

    private RetCode create(CommandLine cl, NetworkConfig config)
            throws ParseException, OvsPortException, IOException {
        if (!cl.hasOption("pid")) {
            throw new ParseException("--create requires --pid");
        }
        int pid = intValue(cl, "pid");
        NetworkState state = new NetworkState();
        strategy.create(config, pid, state);
        if (cl.hasOption("state")) {
            state.writeTo(new File(cl.getOptionValue("state")));
        }
        out.println(state.getOvsPort());
        return RetCode.SUCCESS;
    }

    private RetCode initialize(CommandLine cl, NetworkConfig config)
            throws ParseException, OvsPortException, IOException {
        NetworkState state;
        if (cl.hasOption("port")) {
            state = new NetworkState(cl.getOptionValue("port"));
        } else if (cl.hasOption("state")) {
            state = NetworkState.readFrom(new File(cl.getOptionValue("state")));
        } else {
            throw new ParseException("--initialize requires --port or --state");
        }
        strategy.initialize(config, state);
        return RetCode.SUCCESS;
    }

    private static NetworkConfig networkConfig(CommandLine cl)
            throws ParseException {
        NetworkConfig.Builder builder = NetworkConfig.builder()
            .bridge(cl.getOptionValue("bridge"))
            .vethPrefix(cl.getOptionValue("prefix", "veth"))
            .macAddress(cl.getOptionValue("mac"))
            .address(cl.getOptionValue("address"))
            .ipv6Address(cl.getOptionValue("ipv6-address"))
            .gateway(cl.getOptionValue("gateway"))
            .ipv6Gateway(cl.getOptionValue("ipv6-gateway"));
        if (cl.hasOption("mtu")) {
            builder.mtu(intValue(cl, "mtu"));
        }
        return builder.build();
    }

    private static int intValue(CommandLine cl, String option)
            throws ParseException {
        String value = cl.getOptionValue(option);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParseException(
                "--" + option + " expects a number, got " + value);
        }
    }

    static OvsPortConfig loadConfig(CommandLine cl)
            throws OvsPortException.ConfigurationInvalidException {
        if (cl.hasOption("config")) {
            return OvsPortConfig.load(new File(cl.getOptionValue("config")));
        }
        return OvsPortConfig.load();
    }

    public static void main(String... args) {
        CommandLine cl;
        try {
            cl = parse(args);
        } catch (ParseException e) {
            System.err.println("Error with the options: " + e.getMessage());
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("ovsport-ctl", options());
            System.exit(RetCode.BAD_COMMAND.getCode());
            return;
        }

        OvsPortConfig config;
        try {
            config = loadConfig(cl);
        } catch (OvsPortException e) {
            System.err.println(e.getMessage());
            System.exit(RetCode.CONFIGURATION_INVALID.getCode());
            return;
        }

        // Set up Guice dependencies
        Injector injector = Guice.createInjector(new OvsPortModule(config));
        RetCode res;
        try (PortProvisioner provisioner =
                 injector.getInstance(PortProvisioner.class)) {
            OvsPortCtl ctl = new OvsPortCtl(
                injector.getInstance(NetworkStrategy.class), System.out,
                System.err);
            res = ctl.execute(cl);
        } catch (ProvisionException | ConfigException e) {
            log.error("Invalid configuration", e);
            System.err.println(e.getMessage());
            res = RetCode.CONFIGURATION_INVALID;
        }
        System.exit(res.getCode());
    }
}
