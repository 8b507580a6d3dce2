package net.parley.proto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import net.parley.api.UserIdentity;
import net.parley.testutil.FakeConnection;
import net.parley.testutil.RecordingNotifier;
import net.parley.testutil.Users;
import net.parley.user.ChatUser;
import net.parley.util.TypedBuffer;
import org.junit.jupiter.api.Test;

class ChatChannelTest {

    private final FakeConnection alice = new FakeConnection("alice");
    private final FakeConnection bob = new FakeConnection("bob");
    private final ChatUser aliceUser = Users.identified("alice", "h1");
    private final ChatUser bobUser = Users.identified("bob", "h2");

    @Test
    void membersKeepJoiningOrder() {
        ChatChannel ch = new ChatChannel("#a", alice, aliceUser);
        assertTrue(ch.addMember(bob, bobUser));

        assertEquals(List.<UserIdentity>of(aliceUser, bobUser),
                     ch.getMembers());
        assertEquals(List.<UserIdentity>of(aliceUser), ch.getOperators());
        assertFalse(ch.addMember(bob, bobUser));
    }

    @Test
    void removingLastMemberDisablesForGood() {
        ChatChannel ch = new ChatChannel("#a", alice, aliceUser);

        assertSame(aliceUser, ch.removeMember(alice));
        assertFalse(ch.isEnabled());
        assertFalse(ch.isOperator(alice));
        assertFalse(ch.addMember(bob, bobUser));
        assertNull(ch.removeMember(alice));
    }

    @Test
    void listsSkipDisabledUsersInCountAndBody() throws Exception {
        ChatChannel ch = new ChatChannel("#a", alice, aliceUser);
        ch.addMember(bob, bobUser);
        aliceUser.disable();

        TypedBuffer buf = new TypedBuffer();
        ch.writeOperators(buf);
        ch.writeMembers(buf);

        assertEquals(0, buf.readUInt32());
        assertEquals(1, buf.readUInt32());
        assertEquals("bob", buf.readString());
        assertEquals("h2", buf.readString());
        assertEquals(0, buf.remaining());
    }

    @Test
    void broadcastHonorsExclusionAndEnabledFlag() {
        FakeConnection carol = new FakeConnection("carol");
        ChatUser carolUser = Users.identified("carol", "h3");
        ChatChannel ch = new ChatChannel("#a", alice, aliceUser);
        ch.addMember(bob, bobUser);
        ch.addMember(carol, carolUser);
        carolUser.disable();
        RecordingNotifier notifier = new RecordingNotifier();

        int sent = ch.broadcast(notifier, ChannelMessageType.LEAVE_CHANNEL,
                                new TypedBuffer().writeUInt16(7), alice);

        assertEquals(1, sent);
        assertEquals(1, notifier.to(bob).size());
        assertTrue(notifier.to(alice).isEmpty());
        assertTrue(notifier.to(carol).isEmpty());
    }

}
