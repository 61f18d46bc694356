package org.muma.minikv.replication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.minikv.protocol.RespCodec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReplicationManagerTest {

    private ReplicationManager manager;

    @BeforeEach
    void setUp() {
        manager = new ReplicationManager();
    }

    private static ReplicaHandle replica(boolean active, boolean accepts) {
        ReplicaHandle handle = mock(ReplicaHandle.class);
        when(handle.isActive()).thenReturn(active);
        when(handle.send(any())).thenReturn(accepts);
        when(handle.describe()).thenReturn("mock-replica");
        return handle;
    }

    @Test
    void testPropagateToTwoReplicas() {
        ReplicaHandle r1 = replica(true, true);
        ReplicaHandle r2 = replica(true, true);
        manager.register(r1);
        manager.register(r2);

        byte[] command = RespCodec.encodeCommand("SET", "foo", "bar");
        int peak = manager.propagate(command);

        assertEquals(2, peak);
        // 传播结束后计数被清零
        assertEquals(0, manager.pendingAcks());
        verify(r1).send(command);
        verify(r2).send(command);
    }

    @Test
    void testPropagatePreservesRegistrationOrder() {
        ReplicaHandle r1 = replica(true, true);
        ReplicaHandle r2 = replica(true, true);
        manager.register(r1);
        manager.register(r2);

        manager.propagate(new byte[]{1});

        var order = inOrder(r1, r2);
        order.verify(r1).send(any());
        order.verify(r2).send(any());
    }

    @Test
    void testRejectedSendNotCounted() {
        manager.register(replica(true, true));
        manager.register(replica(true, false));

        assertEquals(1, manager.propagate(new byte[]{1}));
        assertEquals(2, manager.replicaCount());
    }

    @Test
    void testInactiveReplicaDroppedOnPropagate() {
        ReplicaHandle dead = replica(false, true);
        manager.register(replica(true, true));
        manager.register(dead);
        assertEquals(2, manager.replicaCount());

        assertEquals(1, manager.propagate(new byte[]{1}));
        assertEquals(1, manager.replicaCount());
        verify(dead, never()).send(any());
    }

    @Test
    void testWaitForNeverBlocks() {
        manager.register(replica(true, true));
        manager.propagate(new byte[]{1});

        // 计数已被 propagate 清零
        assertEquals(-1, manager.waitFor(1));
        assertEquals(0, manager.waitFor(0));
    }

    @Test
    void testNoReplicas() {
        assertEquals(0, manager.propagate(new byte[]{1}));
        assertEquals(0, manager.replicaCount());
    }
}
