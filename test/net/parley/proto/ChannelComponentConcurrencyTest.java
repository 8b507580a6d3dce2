package net.parley.proto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.parley.api.ResultCode;
import net.parley.testutil.FakeConnection;
import net.parley.testutil.RecordingNotifier;
import net.parley.testutil.Users;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChannelComponentConcurrencyTest {

    private ChannelDirectory directory;
    private Users users;
    private RecordingNotifier notifier;
    private ChannelComponent component;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        directory = new ChannelDirectory();
        users = new Users();
        notifier = new RecordingNotifier();
        component = new ChannelComponent(directory, users, notifier);
        pool = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentFirstJoinsCreateOneChannel() throws Exception {
        for (int round = 0; round < 200; round++) {
            final String name = "#race" + round;
            final FakeConnection a = users.connect("a" + round);
            final FakeConnection b = users.connect("b" + round);
            final CyclicBarrier barrier = new CyclicBarrier(2);
            Future<ResultCode> fa = pool.submit(joiner(barrier, a, name));
            Future<ResultCode> fb = pool.submit(joiner(barrier, b, name));
            ResultCode ra = fa.get(5, TimeUnit.SECONDS);
            ResultCode rb = fb.get(5, TimeUnit.SECONDS);

            List<ResultCode> results = new ArrayList<ResultCode>();
            results.add(ra);
            results.add(rb);
            assertTrue(results.contains(ResultCode.CHANNEL_CREATED),
                       "round " + round + ": " + results);
            assertTrue(results.contains(ResultCode.OK),
                       "round " + round + ": " + results);
            ChatChannel ch = directory.find(name);
            assertEquals(2, ch.getMemberCount());
            assertEquals(1, ch.getOperators().size());
            FakeConnection creator =
                (ra == ResultCode.CHANNEL_CREATED) ? a : b;
            assertTrue(ch.isOperator(creator));
        }
        assertEquals(200, directory.size());
    }

    @Test
    void concurrentJoinsAndLeavesKeepMembershipConsistent()
            throws Exception {
        final int clients = 16;
        final int rounds = 100;
        List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
        final CyclicBarrier barrier = new CyclicBarrier(clients);
        for (int i = 0; i < clients; i++) {
            final FakeConnection conn = users.connect("u" + i);
            futures.add(pool.submit(new Callable<Integer>() {
                public Integer call() throws Exception {
                    barrier.await(5, TimeUnit.SECONDS);
                    int joined = 0;
                    for (int r = 0; r < rounds; r++) {
                        ResultCode res = component.join(conn,
                            users.getUser(conn), "#busy");
                        if (res == ResultCode.OK ||
                                res == ResultCode.CHANNEL_CREATED)
                            joined++;
                        if (r % 2 == 0) {
                            assertEquals(ResultCode.OK, component.leave(conn,
                                users.getUser(conn), "#busy"));
                            joined--;
                        }
                    }
                    return joined;
                }
            }));
        }
        int expected = 0;
        for (Future<Integer> f : futures) expected += f.get(30,
            TimeUnit.SECONDS);

        ChatChannel ch = directory.find("#busy");
        assertEquals(clients, expected);
        assertEquals(expected, ch.getMemberCount());
        assertTrue(ch.getOperators().size() <= ch.getMemberCount());
        assertTrue(directory.size() <= 1);
    }

    private Callable<ResultCode> joiner(final CyclicBarrier barrier,
                                        final FakeConnection conn,
                                        final String name) {
        return new Callable<ResultCode>() {
            public ResultCode call() throws Exception {
                barrier.await(5, TimeUnit.SECONDS);
                return component.join(conn, users.getUser(conn), name);
            }
        };
    }

}
