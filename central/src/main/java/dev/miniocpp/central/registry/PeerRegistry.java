package dev.miniocpp.central.registry;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import dev.miniocpp.protocol.session.ConnectionSession;

/**
 * Maps the identity a charge point announced at boot to its live session. Identities are self-reported and
 * untrusted: a later boot under the same identity replaces the earlier registration.
 */
@Component
public class PeerRegistry {

	private static final Logger logger = LoggerFactory.getLogger(PeerRegistry.class);

	private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

	/**
	 * Register {@code session} under {@code identity}, replacing any other session and dropping older
	 * identities the same session announced.
	 * @param identity self-reported identity
	 * @param session live session of the peer
	 */
	public void upsert(String identity, ConnectionSession session) {
		ConnectionSession previous = this.sessions.put(identity, session);
		this.sessions.entrySet().removeIf(entry -> entry.getValue() == session && !entry.getKey().equals(identity));
		if (previous != null && previous != session) {
			logger.warn("Identity {} re-registered by connection {}, replacing connection {}", identity,
					session.connectionId(), previous.connectionId());
		}
		if (!session.isOpen()) {
			// Closed while booting; its close listener may already have run.
			this.sessions.remove(identity, session);
			return;
		}
		logger.info("Registered charge point {} on connection {}", identity, session.connectionId());
	}

	public Optional<ConnectionSession> lookup(String identity) {
		return Optional.ofNullable(this.sessions.get(identity));
	}

	public boolean remove(String identity) {
		return this.sessions.remove(identity) != null;
	}

	/**
	 * Remove every identity registered to {@code session}. Matches by session, not by identity, so a newer
	 * registration of the same identity survives the close of an older connection.
	 * @param session session that went away
	 * @return number of registrations removed
	 */
	public int removeSession(ConnectionSession session) {
		AtomicInteger removed = new AtomicInteger();
		this.sessions.entrySet().removeIf(entry -> {
			if (entry.getValue() == session) {
				logger.info("Unregistered charge point {} (connection {})", entry.getKey(), session.connectionId());
				removed.incrementAndGet();
				return true;
			}
			return false;
		});
		return removed.get();
	}

	public Set<String> identities() {
		return new TreeSet<>(this.sessions.keySet());
	}

	public int size() {
		return this.sessions.size();
	}

}
