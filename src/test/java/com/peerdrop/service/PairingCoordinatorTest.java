package com.peerdrop.service;

import com.peerdrop.channel.PeerChannel;
import com.peerdrop.channel.RecordingChannel;
import com.peerdrop.dto.SignalMessage;
import com.peerdrop.metrics.RelayMetricsTracker;
import com.peerdrop.model.Payload;
import com.peerdrop.registry.ChannelStateRegistry;
import com.peerdrop.registry.RoomRegistry;
import com.peerdrop.session.PairingPhase;
import com.peerdrop.session.PairingState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PairingCoordinatorTest {

	private RoomRegistry roomRegistry;
	private ChannelStateRegistry channelStates;
	private PairingCoordinator coordinator;

	private RecordingChannel sender;
	private RecordingChannel receiver;

	@BeforeEach
	void setUp() {
		roomRegistry = new RoomRegistry(new CodeGenerator("ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789", 5, 100, new Random(1)));
		channelStates = new ChannelStateRegistry();
		coordinator = new PairingCoordinator(roomRegistry, channelStates,
				new RelayMetricsTracker(roomRegistry, channelStates));

		sender = open("sender");
		receiver = open("receiver");
	}

	@Test
	void senderRegistrationReturnsCode() {
		String code = registerSender();

		assertTrue(code.matches("[A-Z0-9]{5}"));
		assertTrue(roomRegistry.contains(code));
		assertEquals(PairingState.sender(code, PairingPhase.AWAITING_RECEIVER), state(sender));
	}

	@Test
	void receiverJoinIsCaseInsensitiveAndNotifiesBoth() {
		String code = registerSender();

		coordinator.handleMessage(receiver, SignalMessage.builder()
				.type(SignalMessage.REGISTER_RECEIVER)
				.code(code.toLowerCase())
				.build());

		assertEquals(SignalMessage.waitingForFile(), receiver.last());
		assertEquals(SignalMessage.receiverJoined(), sender.last());
		assertEquals(PairingState.receiver(code, PairingPhase.AWAITING_PAYLOAD), state(receiver));
		assertEquals(PairingState.sender(code, PairingPhase.RELAYING), state(sender));
	}

	@Test
	void joinWithUnknownCodeIsRejectedAndMayRetry() {
		String code = registerSender();

		coordinator.registerReceiver(receiver, "NOPE0".equals(code) ? "NOPE1" : "NOPE0");

		assertEquals(SignalMessage.error("Invalid or expired code."), receiver.last());
		assertEquals(PairingState.connected(), state(receiver));
		assertTrue(sender.sentOfType(SignalMessage.RECEIVER_JOINED).isEmpty());

		coordinator.registerReceiver(receiver, code);

		assertEquals(SignalMessage.waitingForFile(), receiver.last());
	}

	@Test
	void secondReceiverIsRejected() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);
		RecordingChannel latecomer = open("latecomer");

		coordinator.registerReceiver(latecomer, code);

		assertEquals(SignalMessage.error("Invalid or expired code."), latecomer.last());
		assertEquals(1, sender.sentOfType(SignalMessage.RECEIVER_JOINED).size());
	}

	@Test
	void repeatedSenderRegistrationIsRejected() {
		registerSender();

		coordinator.registerSender(sender);

		assertEquals(SignalMessage.ERROR, sender.last().getType());
		assertEquals(1, roomRegistry.getActiveRoomCount());
	}

	@Test
	void boundReceiverCannotJoinAnotherRoom() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);
		RecordingChannel otherSender = open("other-sender");
		coordinator.registerSender(otherSender);
		String otherCode = otherSender.last().getCode();

		coordinator.registerReceiver(receiver, otherCode);

		assertEquals(SignalMessage.ERROR, receiver.last().getType());
		assertTrue(otherSender.sentOfType(SignalMessage.RECEIVER_JOINED).isEmpty());
	}

	@Test
	void payloadUploadedNotifiesReceiverOnce() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);
		sender.clear();

		boolean notified = coordinator.payloadUploaded(code, payload("report.pdf", "%PDF-1.4"));

		assertTrue(notified);
		assertEquals(1, receiver.sentOfType(SignalMessage.FILE_READY).size());
		assertEquals(SignalMessage.fileReady("report.pdf", 8), receiver.last());
		assertEquals(PairingState.sender(code, PairingPhase.COMPLETE), state(sender));
		assertTrue(sender.getSent().isEmpty());
	}

	@Test
	void senderDisconnectNotifiesReceiverAndRemovesRoom() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);

		coordinator.channelClosed(sender);

		assertEquals(SignalMessage.error("Sender disconnected."), receiver.last());
		assertFalse(roomRegistry.contains(code));
		assertEquals(PairingState.connected(), state(receiver));
	}

	@Test
	void receiverDisconnectNotifiesSenderAndRemovesRoom() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);

		coordinator.channelClosed(receiver);

		assertEquals(SignalMessage.error("Receiver disconnected."), sender.last());
		assertFalse(roomRegistry.contains(code));
	}

	@Test
	void senderDisconnectBeforeJoinRemovesRoom() {
		String code = registerSender();

		coordinator.channelClosed(sender);

		assertFalse(roomRegistry.contains(code));
		assertTrue(receiver.getSent().isEmpty());
	}

	@Test
	void closingUnregisteredChannelIsNoOp() {
		registerSender();

		coordinator.channelClosed(receiver);

		assertEquals(1, roomRegistry.getActiveRoomCount());
		assertEquals(1, sender.getSent().size());
	}

	@Test
	void teardownRunsOnlyOnce() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);

		coordinator.channelClosed(sender);
		coordinator.channelClosed(sender);

		assertEquals(1, receiver.sentOfType(SignalMessage.ERROR).size());
	}

	@Test
	void failedNotificationDoesNotStopTeardown() {
		String code = registerSender();
		coordinator.registerReceiver(receiver, code);
		receiver.failSends();

		assertDoesNotThrow(() -> coordinator.channelClosed(sender));

		assertFalse(roomRegistry.contains(code));
	}

	@Test
	void joinSucceedsEvenIfSenderIsUnreachable() {
		String code = registerSender();
		sender.close();

		coordinator.registerReceiver(receiver, code);

		assertEquals(SignalMessage.waitingForFile(), receiver.last());
	}

	@Test
	void unknownMessageTypeIsIgnored() {
		coordinator.handleMessage(sender, SignalMessage.builder().type("ping").build());

		assertTrue(sender.getSent().isEmpty());
		assertEquals(PairingState.connected(), state(sender));
	}

	@Test
	void registrationFromUnopenedChannelCreatesNoRoom() {
		RecordingChannel stranger = new RecordingChannel("stranger");

		coordinator.registerSender(stranger);

		assertEquals(0, roomRegistry.getActiveRoomCount());
		assertTrue(stranger.getSent().isEmpty());
	}

	@Test
	void exhaustedCodeSpaceIsReportedToSender() {
		useRegistry(new RoomRegistry(new CodeGenerator("A", 1, 3, new Random(1))));
		assertEquals("A", registerSender());
		RecordingChannel secondSender = open("second-sender");

		coordinator.registerSender(secondSender);

		assertEquals(SignalMessage.error("Could not allocate a room code after 3 attempts. Please try again."),
				secondSender.last());
		assertEquals(PairingState.connected(), state(secondSender));
		assertEquals(1, roomRegistry.getActiveRoomCount());
	}

	@Test
	void senderClosingWhileRoomIsAllocatedLeavesNoRoom() {
		useRegistry(new RoomRegistry(new CodeGenerator("ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789", 5, 100, new Random(1))) {
			@Override
			public String createRoom(PeerChannel channel) {
				String code = super.createRoom(channel);
				coordinator.channelClosed(sender);
				return code;
			}
		});

		coordinator.registerSender(sender);

		assertEquals(0, roomRegistry.getActiveRoomCount());
		assertTrue(sender.getSent().isEmpty());
		assertTrue(channelStates.get(sender.getId()).isEmpty());
	}

	@Test
	void receiverClosingWhileJoiningNotifiesSenderAndRemovesRoom() {
		useRegistry(new RoomRegistry(new CodeGenerator("ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789", 5, 100, new Random(1))) {
			@Override
			public void bindReceiver(String code, PeerChannel channel) {
				super.bindReceiver(code, channel);
				coordinator.channelClosed(receiver);
			}
		});
		String code = registerSender();

		coordinator.registerReceiver(receiver, code);

		assertEquals(SignalMessage.error("Receiver disconnected."), sender.last());
		assertTrue(sender.sentOfType(SignalMessage.RECEIVER_JOINED).isEmpty());
		assertEquals(PairingState.connected(), state(sender));
		assertFalse(roomRegistry.contains(code));
		assertTrue(receiver.getSent().isEmpty());
	}

	@Test
	void senderClosingWhileReceiverJoinsNotifiesReceiver() {
		useRegistry(new RoomRegistry(new CodeGenerator("ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789", 5, 100, new Random(1))) {
			@Override
			public void bindReceiver(String code, PeerChannel channel) {
				super.bindReceiver(code, channel);
				coordinator.channelClosed(sender);
			}
		});
		String code = registerSender();

		coordinator.registerReceiver(receiver, code);

		assertEquals(SignalMessage.waitingForFile(), receiver.getSent().get(0));
		assertEquals(SignalMessage.error("Sender disconnected."), receiver.last());
		assertEquals(PairingState.connected(), state(receiver));
		assertFalse(roomRegistry.contains(code));
	}

	private void useRegistry(RoomRegistry registry) {
		roomRegistry = registry;
		channelStates = new ChannelStateRegistry();
		coordinator = new PairingCoordinator(roomRegistry, channelStates,
				new RelayMetricsTracker(roomRegistry, channelStates));
		sender = open("sender");
		receiver = open("receiver");
	}

	private RecordingChannel open(String id) {
		RecordingChannel channel = new RecordingChannel(id);
		coordinator.channelOpened(channel);
		return channel;
	}

	private String registerSender() {
		coordinator.handleMessage(sender, SignalMessage.builder().type(SignalMessage.REGISTER_SENDER).build());
		SignalMessage reply = sender.last();
		assertEquals(SignalMessage.CODE_GENERATED, reply.getType());
		return reply.getCode();
	}

	private PairingState state(RecordingChannel channel) {
		return channelStates.get(channel.getId()).orElseThrow();
	}

	private static Payload payload(String name, String content) {
		return Payload.builder().filename(name).content(content.getBytes(StandardCharsets.UTF_8)).build();
	}
}
