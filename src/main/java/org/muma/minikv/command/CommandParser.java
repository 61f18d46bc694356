package org.muma.minikv.command;

import java.util.List;
import java.util.Locale;

/**
 * 把 Bulk String 参数列表解析成 {@link Command}。
 * 参数个数或形状不对时抛出 IllegalArgumentException，消息即错误回复 (不含 "ERR " 前缀)。
 */
public class CommandParser {

    static final String SYNTAX_ERROR = "syntax error";
    static final String NOT_AN_INTEGER = "value is not an integer or out of range";

    public Command parse(List<String> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("empty command");
        }
        String name = args.get(0).toUpperCase(Locale.ROOT);
        int argc = args.size() - 1;

        return switch (name) {
            case "PING" -> {
                if (argc > 1) throw wrongArity(name);
                yield new Command.Ping(argc == 1 ? args.get(1) : null);
            }
            case "ECHO" -> {
                if (argc != 1) throw wrongArity(name);
                yield new Command.Echo(args.get(1));
            }
            case "SET" -> parseSet(args);
            case "GET" -> {
                if (argc != 1) throw wrongArity(name);
                yield new Command.Get(args.get(1));
            }
            case "KEYS" -> {
                if (argc != 1) throw wrongArity(name);
                yield new Command.Keys(args.get(1));
            }
            case "CONFIG" -> parseConfig(args);
            case "INFO" -> {
                if (argc > 1) throw wrongArity(name);
                yield new Command.Info(argc == 1 ? args.get(1) : null);
            }
            case "REPLCONF" -> parseReplConf(args);
            case "PSYNC" -> {
                if (argc != 2) throw wrongArity(name);
                yield new Command.Psync(args.get(1), parseLong(args.get(2)));
            }
            case "WAIT" -> {
                if (argc != 2) throw wrongArity(name);
                long numReplicas = parseLong(args.get(1));
                long timeout = parseLong(args.get(2));
                if (numReplicas < 0 || numReplicas > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException(NOT_AN_INTEGER);
                }
                if (timeout < 0) {
                    throw new IllegalArgumentException("timeout is negative");
                }
                yield new Command.Wait((int) numReplicas, timeout);
            }
            default -> new Command.Unknown(args.get(0));
        };
    }

    // SET key value [PX milliseconds]
    private Command parseSet(List<String> args) {
        if (args.size() < 3) {
            throw wrongArity("SET");
        }
        if (args.size() == 3) {
            return new Command.Set(args.get(1), args.get(2));
        }
        if (args.size() != 5 || !"PX".equalsIgnoreCase(args.get(3))) {
            throw new IllegalArgumentException(SYNTAX_ERROR);
        }
        long millis = parseLong(args.get(4));
        if (millis <= 0) {
            throw new IllegalArgumentException("invalid expire time in 'set' command");
        }
        return new Command.Set(args.get(1), args.get(2), millis);
    }

    // CONFIG GET parameter
    private Command parseConfig(List<String> args) {
        if (args.size() < 2) {
            throw wrongArity("CONFIG");
        }
        String sub = args.get(1).toUpperCase(Locale.ROOT);
        if (!"GET".equals(sub)) {
            throw new IllegalArgumentException("unknown subcommand '" + args.get(1) + "'");
        }
        if (args.size() != 3) {
            throw wrongArity("CONFIG|GET");
        }
        return new Command.ConfigGet(args.get(2));
    }

    private Command parseReplConf(List<String> args) {
        if (args.size() < 3) {
            throw wrongArity("REPLCONF");
        }
        String option = args.get(1).toLowerCase(Locale.ROOT);
        return switch (option) {
            case "listening-port" -> {
                long port = parseLong(args.get(2));
                if (port < 0 || port > 65535) {
                    throw new IllegalArgumentException(NOT_AN_INTEGER);
                }
                yield new Command.ReplConfListeningPort((int) port);
            }
            case "capa" -> new Command.ReplConfCapa(List.copyOf(args.subList(2, args.size())));
            case "getack" -> {
                if (!"*".equals(args.get(2))) throw new IllegalArgumentException(SYNTAX_ERROR);
                yield new Command.ReplConfGetAck();
            }
            case "ack" -> new Command.ReplConfAck(parseLong(args.get(2)));
            default -> throw new IllegalArgumentException("Unrecognized REPLCONF option: " + args.get(1));
        };
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(NOT_AN_INTEGER);
        }
    }

    private static IllegalArgumentException wrongArity(String cmd) {
        return new IllegalArgumentException("wrong number of arguments for '" + cmd.toLowerCase(Locale.ROOT) + "' command");
    }
}
