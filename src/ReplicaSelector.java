/*
 * Copyright (C) 2026  The Async Tablet Authors.  All rights reserved.
 * This file is part of Async Tablet.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   - Redistributions of source code must retain the above copyright notice,
 *     this list of conditions and the following disclaimer.
 *   - Redistributions in binary form must reproduce the above copyright notice,
 *     this list of conditions and the following disclaimer in the documentation
 *     and/or other materials provided with the distribution.
 *   - Neither the name of the StumbleUpon nor the names of its contributors
 *     may be used to endorse or promote products derived from this software
 *     without specific prior written permission.
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.tablet.async;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Picks which replica of a tablet a request should be sent to.
 * <p>
 * This class has no state: every input comes in through the arguments, so
 * it's safe to use from any number of threads without locking.  The only
 * policy that needs to remember something across calls,
 * {@link ReplicaSelection#ANY_AVAILABLE}, takes a rotation cursor that the
 * caller maintains.
 *
 * <h1>Closest replica</h1>
 * Each candidate gets an affinity with the caller, from best to worst:
 * <ol>
 *   <li>the candidate <i>is</i> the caller (no network hop at all),</li>
 *   <li>same zone (which implies the same region and cloud),</li>
 *   <li>same region,</li>
 *   <li>same cloud,</li>
 *   <li>nothing in common.</li>
 * </ol>
 * We pick from the best non-empty tier.  Ties are broken by the order in
 * which the metadata authority listed the replicas, so the outcome is
 * deterministic.
 */
final class ReplicaSelector {

  // Affinity tiers, best first.
  static final int SELF = 0;
  static final int SAME_ZONE = 1;
  static final int SAME_REGION = 2;
  static final int SAME_CLOUD = 3;
  static final int NO_MATCH = 4;
  private static final int NUM_TIERS = 5;

  private ReplicaSelector() {  // Can't instantiate.
  }

  /**
   * Chooses a replica.
   * @param tablet_id The ID of the tablet, for error messages.
   * @param replicas The replicas of the tablet, in the authority's order.
   * @param locality Who's asking.
   * @param policy How to choose.
   * @param excluded UUIDs of servers that must not be chosen, e.g. because
   * they just failed.  Can be {@code null}.
   * @param cursor Rotation cursor, only used by
   * {@link ReplicaSelection#ANY_AVAILABLE}.
   * @return The chosen replica and the fallbacks, best first.
   * @throws NoAvailableReplicaException if every replica is excluded or dead.
   * @throws NoLeaderKnownException if the policy is
   * {@link ReplicaSelection#LEADER_ONLY} and no replica is the leader.
   */
  static ReplicaChoice select(final String tablet_id,
                              final List<RemoteReplica> replicas,
                              final ClientLocality locality,
                              final ReplicaSelection policy,
                              final Set<String> excluded,
                              final int cursor) {
    switch (policy) {
      case CLOSEST_REPLICA:
        return selectClosest(tablet_id, replicas, locality, excluded);
      case LEADER_ONLY:
        return selectLeader(tablet_id, replicas, excluded);
      case ANY_AVAILABLE:
        return selectAny(tablet_id, replicas, excluded, cursor);
      default:
        throw new AssertionError("Unknown replica selection: " + policy);
    }
  }

  /**
   * Returns the affinity tier of a replica for the given caller.
   * @see #SELF
   */
  static int affinity(final RemoteReplica replica,
                      final ClientLocality locality) {
    final String caller = locality.getUuid();
    if (caller != null && caller.equals(replica.uuid())) {
      return SELF;
    }
    final CloudInfo them = replica.server().getCloudInfo();
    final CloudInfo us = locality.getCloudInfo();
    if (them.sameZone(us)) {
      return SAME_ZONE;
    } else if (them.sameRegion(us)) {
      return SAME_REGION;
    } else if (them.sameCloud(us)) {
      return SAME_CLOUD;
    }
    return NO_MATCH;
  }

  private static ReplicaChoice selectClosest(final String tablet_id,
                                             final List<RemoteReplica> replicas,
                                             final ClientLocality locality,
                                             final Set<String> excluded) {
    final List<RemoteReplica> candidates =
      candidates(tablet_id, replicas, excluded);
    // Bucket sort by tier: stable, so ties keep the authority's order.
    @SuppressWarnings("unchecked")
    final List<RemoteReplica>[] tiers = new List[NUM_TIERS];
    for (final RemoteReplica replica : candidates) {
      final int tier = affinity(replica, locality);
      if (tiers[tier] == null) {
        tiers[tier] = new ArrayList<RemoteReplica>(candidates.size());
      }
      tiers[tier].add(replica);
    }
    final List<RemoteReplica> ranked =
      new ArrayList<RemoteReplica>(candidates.size());
    for (final List<RemoteReplica> tier : tiers) {
      if (tier != null) {
        ranked.addAll(tier);
      }
    }
    return new ReplicaChoice(ranked.get(0), ranked.subList(1, ranked.size()));
  }

  private static ReplicaChoice selectLeader(final String tablet_id,
                                            final List<RemoteReplica> replicas,
                                            final Set<String> excluded) {
    RemoteReplica leader = null;
    for (final RemoteReplica replica : replicas) {
      if (replica.role() == ReplicaRole.LEADER) {
        leader = replica;
        break;
      }
    }
    if (leader == null) {
      throw new NoLeaderKnownException(tablet_id);
    }
    if (!isUsable(leader, excluded)) {
      throw new NoAvailableReplicaException(tablet_id, "The leader "
        + leader.uuid() + " is " + (isExcluded(leader, excluded)
                                    ? "excluded" : "dead"));
    }
    return new ReplicaChoice(leader, Collections.<RemoteReplica>emptyList());
  }

  private static ReplicaChoice selectAny(final String tablet_id,
                                         final List<RemoteReplica> replicas,
                                         final Set<String> excluded,
                                         final int cursor) {
    final List<RemoteReplica> candidates =
      candidates(tablet_id, replicas, excluded);
    final int n = candidates.size();
    final int start = ((cursor % n) + n) % n;  // The cursor may have wrapped.
    final List<RemoteReplica> rotated = new ArrayList<RemoteReplica>(n);
    for (int i = 0; i < n; i++) {
      rotated.add(candidates.get((start + i) % n));
    }
    return new ReplicaChoice(rotated.get(0), rotated.subList(1, n));
  }

  /**
   * Returns the replicas that are neither excluded nor dead, in order.
   * @throws NoAvailableReplicaException if there's none left.
   */
  private static List<RemoteReplica> candidates(final String tablet_id,
                                                final List<RemoteReplica> replicas,
                                                final Set<String> excluded) {
    final List<RemoteReplica> candidates =
      new ArrayList<RemoteReplica>(replicas.size());
    for (final RemoteReplica replica : replicas) {
      if (isUsable(replica, excluded)) {
        candidates.add(replica);
      }
    }
    if (candidates.isEmpty()) {
      throw new NoAvailableReplicaException(tablet_id, "All "
        + replicas.size() + " replicas are excluded or dead");
    }
    return candidates;
  }

  private static boolean isUsable(final RemoteReplica replica,
                                  final Set<String> excluded) {
    return !isExcluded(replica, excluded)
      && replica.server().getHealth() != TabletServer.Health.DEAD;
  }

  private static boolean isExcluded(final RemoteReplica replica,
                                    final Set<String> excluded) {
    return excluded != null && excluded.contains(replica.uuid());
  }

}
