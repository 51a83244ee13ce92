package com.peerdrop.registry;

import com.peerdrop.channel.PeerChannel;
import com.peerdrop.exception.CodeSpaceExhaustedException;
import com.peerdrop.exception.NoReceiverException;
import com.peerdrop.exception.PayloadNotFoundException;
import com.peerdrop.exception.ReceiverAlreadyBoundException;
import com.peerdrop.exception.RoomNotFoundException;
import com.peerdrop.model.Payload;
import com.peerdrop.model.PeerRole;
import com.peerdrop.service.CodeGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide table of live rooms keyed by code.
 * Every operation runs under one lock, so code allocation and receiver binding cannot race.
 * Nothing here sends to a channel; callers push notifications after the lock is released.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoomRegistry {

	private final CodeGenerator codeGenerator;
	private final Map<String, Room> rooms = new HashMap<>();
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Allocate a fresh code and open a room with {@code sender} bound.
	 *
	 * @throws CodeSpaceExhaustedException if no free code could be found
	 */
	public String createRoom(PeerChannel sender) {
		lock.lock();
		try {
			String code = codeGenerator.generate(rooms::containsKey);
			rooms.put(code, new Room(code, sender));
			log.info("Room {} created for sender {} ({} active)", code, sender.getId(), rooms.size());
			return code;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @throws RoomNotFoundException if no room exists for {@code code}
	 * @throws ReceiverAlreadyBoundException if the room already has a receiver
	 */
	public void bindReceiver(String code, PeerChannel receiver) {
		lock.lock();
		try {
			Room room = requireRoom(code);
			if (room.hasReceiver()) {
				throw new ReceiverAlreadyBoundException(code);
			}
			room.setReceiverChannel(receiver);
			log.info("Receiver {} bound to room {}", receiver.getId(), code);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Store the payload in the room, replacing any earlier one.
	 *
	 * @throws RoomNotFoundException if the room is gone
	 * @throws NoReceiverException if no receiver has joined yet
	 */
	public void attachPayload(String code, Payload payload) {
		lock.lock();
		try {
			Room room = requireRoom(code);
			if (!room.hasReceiver()) {
				throw new NoReceiverException(code);
			}
			room.setPayload(payload);
			log.info("Payload {} ({} bytes) attached to room {}", payload.getFilename(), payload.getSize(), code);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Read the stored payload. Repeated reads return the same payload.
	 *
	 * @throws RoomNotFoundException if the room is gone
	 * @throws PayloadNotFoundException if nothing was uploaded yet
	 */
	public Payload takePayload(String code) {
		lock.lock();
		try {
			Payload payload = requireRoom(code).getPayload();
			if (payload == null) {
				throw new PayloadNotFoundException(code);
			}
			return payload;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return {@code false} if the room was already gone
	 */
	public boolean removeRoom(String code) {
		lock.lock();
		try {
			Room removed = rooms.remove(code);
			if (removed == null) {
				return false;
			}
			log.info("Room {} removed after {}s ({} active)", code,
					Duration.between(removed.getCreatedAt(), Instant.now()).toSeconds(), rooms.size());
			return true;
		} finally {
			lock.unlock();
		}
	}

	public Optional<PeerChannel> getPeerChannel(String code, PeerRole role) {
		lock.lock();
		try {
			Room room = rooms.get(code);
			return room == null ? Optional.empty() : Optional.ofNullable(room.getChannel(role));
		} finally {
			lock.unlock();
		}
	}

	public boolean contains(String code) {
		lock.lock();
		try {
			return rooms.containsKey(code);
		} finally {
			lock.unlock();
		}
	}

	public int getActiveRoomCount() {
		lock.lock();
		try {
			return rooms.size();
		} finally {
			lock.unlock();
		}
	}

	private Room requireRoom(String code) {
		Room room = rooms.get(code);
		if (room == null) {
			throw new RoomNotFoundException(code);
		}
		return room;
	}
}
