package org.muma.minikv.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.minikv.command.CommandProcessor;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.RespDecoder;
import org.muma.minikv.protocol.RespEncoder;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ReplicationMetadata;
import org.muma.minikv.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RedisCommandHandlerTest {

    private CommandProcessor processor;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        processor = new CommandProcessor(new MemoryStorageEngine(), new ReplicationManager(),
                new ReplicationMetadata(), new MiniKvConfig());
        channel = newClient();
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private EmbeddedChannel newClient() {
        return new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new RedisCommandHandler(processor));
    }

    private static void send(EmbeddedChannel ch, String raw) {
        ch.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.UTF_8));
    }

    private static String reply(EmbeddedChannel ch) {
        ByteBuf out = ch.readOutbound();
        if (out == null) {
            return null;
        }
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    void testPing() {
        send(channel, "*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply(channel));
    }

    @Test
    void testSetGetOverTheWire() {
        send(channel, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
        assertEquals("+OK\r\n", reply(channel));

        send(channel, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
        assertEquals("$3\r\nbar\r\n", reply(channel));
    }

    @Test
    void testRepliesInRequestOrder() {
        send(channel, "*2\r\n$4\r\nECHO\r\n$1\r\na\r\n*2\r\n$4\r\nECHO\r\n$1\r\nb\r\n");
        assertEquals("$1\r\na\r\n", reply(channel));
        assertEquals("$1\r\nb\r\n", reply(channel));
        assertNull(reply(channel));
    }

    @Test
    void testFrameSplitAcrossReads() {
        send(channel, "*2\r\n$4\r\nEC");
        assertNull(reply(channel));
        send(channel, "HO\r\n$3\r\nhey\r\n");
        assertEquals("$3\r\nhey\r\n", reply(channel));
    }

    @Test
    void testProtocolErrorKeepsConnectionOpen() {
        send(channel, "GET foo\r\n");
        String error = reply(channel);
        assertNotNull(error);
        assertTrue(error.startsWith("-ERR Protocol error"));
        assertTrue(channel.isOpen());

        send(channel, "*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply(channel));
    }

    @Test
    void testUnknownCommand() {
        send(channel, "*1\r\n$7\r\nFLUSHDB\r\n");
        assertEquals("-ERR unknown command\r\n", reply(channel));
    }

    @Test
    void testKeyspaceSharedBetweenConnections() {
        EmbeddedChannel other = newClient();
        try {
            send(channel, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n");
            reply(channel);

            send(other, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
            assertEquals("$1\r\nv\r\n", reply(other));
        } finally {
            other.finishAndReleaseAll();
        }
    }
}
