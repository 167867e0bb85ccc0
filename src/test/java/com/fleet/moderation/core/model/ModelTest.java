package com.fleet.moderation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("ModerationRights presets")
    class Rights {

        @Test
        @DisplayName("Bans exclude the target, mutes and lifts do not")
        void testFullExclusion() {
            assertTrue(ModerationRights.fullBan().isFullExclusion());
            assertTrue(ModerationRights.ban().isFullExclusion());
            assertTrue(ModerationRights.expel().isFullExclusion());
            assertFalse(ModerationRights.unban().isFullExclusion());
            assertFalse(ModerationRights.mute(Instant.parse("2026-01-01T00:00:00Z")).isFullExclusion());
        }

        @Test
        @DisplayName("Expel and lifts carry an immediate-lift date, bans last forever")
        void testUntil() {
            assertNull(ModerationRights.fullBan().until());
            assertEquals(Instant.EPOCH, ModerationRights.expel().until());
            assertEquals(Instant.EPOCH, ModerationRights.unmute().until());
        }

        @Test
        @DisplayName("Mute requires an end time")
        void testMuteRequiresEnd() {
            assertThrows(IllegalArgumentException.class, () -> ModerationRights.mute(null));
        }
    }

    @Nested
    @DisplayName("MembershipInfo")
    class Membership {

        @Test
        @DisplayName("Only administrators with restrict rights can moderate")
        void testCanModerate() {
            Person agent = Person.of(1L, "Agent");
            assertTrue(MembershipInfo.admin(agent, true).canModerate());
            assertFalse(MembershipInfo.admin(agent, false).canModerate());
            assertFalse(MembershipInfo.member(agent).canModerate());
        }

        @Test
        @DisplayName("Persona memberships expose the channel id")
        void testPersona() {
            Broadcast channel = Broadcast.of(-1001L, "News");
            MembershipInfo info = MembershipInfo.persona(-1001L, List.of(channel));

            assertEquals(-1001L, info.persona().getAsLong());
            assertTrue(info.identityFor(-1001L).isPresent());
            assertTrue(MembershipInfo.member(channel).persona().isEmpty());
        }

        @Test
        @DisplayName("Missing role defaults to member")
        void testDefaultRole() {
            assertEquals(MemberRole.MEMBER, new MembershipInfo(null, true, null, null).role());
        }
    }

    @Nested
    @DisplayName("PeerRef")
    class Peers {

        @Test
        @DisplayName("Raw peers need an access hash and keep the identity kind")
        void testRaw() {
            Person withHash = new Person(50L, "Bob", null, "bob", 1234L);
            Broadcast channelWithHash = new Broadcast(-7L, "Chan", null, 99L);

            assertEquals(PeerRef.Kind.PERSON, ((PeerRef.Raw) PeerRef.raw(withHash)).kind());
            assertEquals(PeerRef.Kind.CHANNEL, ((PeerRef.Raw) PeerRef.raw(channelWithHash)).kind());
            assertThrows(IllegalArgumentException.class, () -> PeerRef.raw(Person.of(51L, "NoHash")));
        }

        @Test
        @DisplayName("Unknown identities display as the bare id")
        void testDisplay() {
            assertEquals("77", Identity.display(null, 77L));
            assertTrue(Identity.display(new Person(50L, "Bob", null, "bob", 0L), 50L).contains("@bob"));
        }
    }
}
