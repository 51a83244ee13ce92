package com.peerdrop.metrics;

import com.peerdrop.registry.ChannelStateRegistry;
import com.peerdrop.registry.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates pairing and relay activity so the log gets one summary line per interval
 * instead of a line per event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayMetricsTracker {

	private final RoomRegistry roomRegistry;
	private final ChannelStateRegistry channelStateRegistry;

	private final LongAdder roomsCreated = new LongAdder();
	private final LongAdder receiversJoined = new LongAdder();
	private final LongAdder roomsClosed = new LongAdder();
	private final LongAdder uploads = new LongAdder();
	private final LongAdder uploadedBytes = new LongAdder();
	private final LongAdder downloads = new LongAdder();
	private final LongAdder downloadedBytes = new LongAdder();
	private final AtomicLong lastLogTime = new AtomicLong(System.currentTimeMillis());

	public void recordRoomCreated() {
		roomsCreated.increment();
	}

	public void recordReceiverJoined() {
		receiversJoined.increment();
	}

	public void recordRoomClosed() {
		roomsClosed.increment();
	}

	public void recordUpload(long bytes) {
		uploads.increment();
		uploadedBytes.add(bytes);
	}

	public void recordDownload(long bytes) {
		downloads.increment();
		downloadedBytes.add(bytes);
	}

	/**
	 * Log aggregated activity. Skipped when nothing happened in the window.
	 */
	@Scheduled(fixedRateString = "${peerdrop.metrics.log-interval-ms:60000}")
	public void logRelayStats() {
		long created = roomsCreated.sumThenReset();
		long joined = receiversJoined.sumThenReset();
		long closed = roomsClosed.sumThenReset();
		long uploadCount = uploads.sumThenReset();
		long upBytes = uploadedBytes.sumThenReset();
		long downloadCount = downloads.sumThenReset();
		long downBytes = downloadedBytes.sumThenReset();
		long now = System.currentTimeMillis();
		long windowMs = now - lastLogTime.getAndSet(now);

		if (created + joined + closed + uploadCount + downloadCount == 0 || windowMs <= 0) {
			return;
		}

		log.info("Relay stats: roomsCreated={}, receiversJoined={}, roomsClosed={}, uploads={} ({} KB), downloads={} ({} KB), activeRooms={}, openChannels={}, window={}ms",
			created,
			joined,
			closed,
			uploadCount,
			String.format("%.1f", upBytes / 1024.0),
			downloadCount,
			String.format("%.1f", downBytes / 1024.0),
			roomRegistry.getActiveRoomCount(),
			channelStateRegistry.getOpenChannelCount(),
			windowMs);
	}
}
