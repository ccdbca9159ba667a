package com.example.neoncollapse.combat;

import com.example.neoncollapse.config.CombatRules;
import com.example.neoncollapse.model.GridPosition;
import com.example.neoncollapse.model.Team;
import com.example.neoncollapse.util.Dice;
import com.example.neoncollapse.util.RandomDice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A single encounter between the player team and the opponent team.
 *
 * Owns both rosters as one arena (player roster first, then opponents); every
 * actor is addressed by its index in the arena. Turn order, targets and
 * sacrifice choices are all actor ids.
 *
 * Victory and defeat are checked after every damage application and every turn
 * advance, so a wiped-out team never gets another turn.
 */
public class CombatEncounter {

    private static final Logger logger = LoggerFactory.getLogger(CombatEncounter.class);

    /** Upper bound on controller actions in one opponent turn */
    private static final int MAX_OPPONENT_ACTIONS_PER_TURN = 16;

    private final CombatRules rules;
    private final DamageResolver resolver;
    private final EscapeNegotiator escapeNegotiator;
    private final OpponentController opponentController;

    /** Every actor, indexed by actor id */
    private final List<CombatActor> arena;

    private final int playerCount;

    private final TurnScheduler scheduler;

    private CombatState state = CombatState.INITIALIZING;

    /** Set once the encounter terminates */
    private CombatOutcome outcome;

    private boolean escapeAvailable = false;

    /** Player-facing log of everything that happened, oldest first */
    private final List<String> combatLog = new ArrayList<>();

    public CombatEncounter(List<CombatActor> playerTeam, List<CombatActor> opponentTeam) {
        this(playerTeam, opponentTeam, CombatRules.defaults(), new RandomDice());
    }

    public CombatEncounter(List<CombatActor> playerTeam, List<CombatActor> opponentTeam, Dice dice) {
        this(playerTeam, opponentTeam, CombatRules.defaults(), dice);
    }

    /**
     * Validate both rosters, roll initiative and start the first turn.
     *
     * @throws InvalidEncounterException if either roster is null, empty, has no
     *         living actor, or holds an actor that cannot join this encounter
     *         (wrong team, already enrolled, listed twice, or built under other rules)
     */
    public CombatEncounter(List<CombatActor> playerTeam, List<CombatActor> opponentTeam,
                           CombatRules rules, Dice dice) {
        if (rules == null) {
            throw new InvalidEncounterException("Combat rules are required");
        }
        validateRoster("Player", playerTeam, Team.PLAYER, rules);
        validateRoster("Opponent", opponentTeam, Team.OPPONENT, rules);
        validateDistinct(playerTeam, opponentTeam);

        this.rules = rules;
        this.resolver = new DamageResolver(rules, dice);
        this.escapeNegotiator = new EscapeNegotiator(rules, dice);
        this.opponentController = new OpponentController();

        List<CombatActor> actors = new ArrayList<>(playerTeam.size() + opponentTeam.size());
        actors.addAll(playerTeam);
        actors.addAll(opponentTeam);
        for (int id = 0; id < actors.size(); id++) {
            actors.get(id).enroll(id);
        }
        this.arena = Collections.unmodifiableList(actors);
        this.playerCount = playerTeam.size();

        this.scheduler = new TurnScheduler(arena, dice);
        logEvent("=== COMBAT START ===");
        for (int id : scheduler.getOrder()) {
            logEvent(arena.get(id).getName() + " rolled initiative: " + scheduler.getInitiative(id));
        }

        state = CombatState.IN_PROGRESS;
        CombatActor first = getCurrentActor();
        first.startTurn();
        logTurnBanner(first);
        logger.info("[CombatEncounter] Started: {} players vs {} opponents, {} acts first",
            playerCount, arena.size() - playerCount, first.getName());
    }

    private static void validateRoster(String label, List<CombatActor> roster, Team team, CombatRules rules) {
        if (roster == null || roster.isEmpty()) {
            throw new InvalidEncounterException(label + " roster is empty");
        }
        boolean anyAlive = false;
        for (CombatActor actor : roster) {
            if (actor == null) {
                throw new InvalidEncounterException(label + " roster contains a null actor");
            }
            if (actor.getTeam() != team) {
                throw new InvalidEncounterException(actor.getName() + " is on the "
                    + actor.getTeam().getDisplayName() + " team but listed in the " + label + " roster");
            }
            if (!actor.getRules().equals(rules)) {
                throw new InvalidEncounterException(actor.getName() + " was built under different combat rules");
            }
            if (actor.isEnrolled()) {
                throw new InvalidEncounterException(actor.getName() + " already belongs to an encounter");
            }
            anyAlive |= actor.isAlive();
        }
        if (!anyAlive) {
            throw new InvalidEncounterException(label + " roster has no living actor");
        }
    }

    private static void validateDistinct(List<CombatActor> playerTeam, List<CombatActor> opponentTeam) {
        Map<CombatActor, Boolean> seen = new IdentityHashMap<>();
        for (CombatActor actor : playerTeam) {
            if (seen.put(actor, Boolean.TRUE) != null) {
                throw new InvalidEncounterException(actor.getName() + " is listed more than once");
            }
        }
        for (CombatActor actor : opponentTeam) {
            if (seen.put(actor, Boolean.TRUE) != null) {
                throw new InvalidEncounterException(actor.getName() + " is listed more than once");
            }
        }
    }

    // State

    public CombatRules getRules() { return rules; }

    public CombatState getState() { return state; }

    public boolean isCombatActive() { return state == CombatState.IN_PROGRESS; }

    /**
     * @return how the encounter ended, or null while it is still running
     */
    public CombatOutcome getOutcome() { return outcome; }

    public int getRound() { return scheduler.getRound(); }

    /**
     * Whether the player team may attempt to escape. Updated at the round
     * boundary before the round's first turn starts.
     */
    public boolean isEscapeAvailable() { return escapeAvailable; }

    // Actors

    public CombatActor getActor(int actorId) {
        if (actorId < 0 || actorId >= arena.size()) {
            throw new IllegalArgumentException("No actor with id " + actorId);
        }
        return arena.get(actorId);
    }

    public List<CombatActor> getActors() { return arena; }

    public List<CombatActor> getPlayerTeam() {
        return arena.subList(0, playerCount);
    }

    public List<CombatActor> getOpponentTeam() {
        return arena.subList(playerCount, arena.size());
    }

    public List<Integer> getTurnOrder() { return scheduler.getOrder(); }

    public int getInitiative(int actorId) { return scheduler.getInitiative(actorId); }

    public int getCurrentActorId() { return scheduler.getCurrentActorId(); }

    public CombatActor getCurrentActor() {
        return arena.get(scheduler.getCurrentActorId());
    }

    public boolean isPlayerTurn() {
        return isCombatActive() && getCurrentActor().isPlayerTeam();
    }

    public boolean isOpponentTurn() {
        return isCombatActive() && !getCurrentActor().isPlayerTeam();
    }

    // Legality queries

    /**
     * Tiles the actor could move to: in bounds, within movement range,
     * not its own tile and not held by a living actor.
     */
    public List<GridPosition> getValidMoves(int actorId) {
        CombatActor actor = getActor(actorId);
        List<GridPosition> moves = new ArrayList<>();
        if (!actor.isAlive()) return moves;

        int range = actor.getMovementRange();
        GridPosition from = actor.getPosition();
        for (int dx = -range; dx <= range; dx++) {
            for (int dy = -range; dy <= range; dy++) {
                if (Math.abs(dx) + Math.abs(dy) > range || (dx == 0 && dy == 0)) continue;
                GridPosition to = from.offset(dx, dy);
                if (rules.isInBounds(to.getX(), to.getY()) && !isOccupied(to, actor)) {
                    moves.add(to);
                }
            }
        }
        return moves;
    }

    private boolean isOccupied(GridPosition tile, CombatActor mover) {
        for (CombatActor other : arena) {
            if (other != mover && other.isAlive() && other.getPosition().equals(tile)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ids of living hostile actors within the actor's weapon range, in roster order.
     */
    public List<Integer> getValidTargets(int actorId) {
        CombatActor actor = getActor(actorId);
        List<Integer> targets = new ArrayList<>();
        if (!actor.isAlive()) return targets;

        int range = actor.getWeapon().getRange();
        for (CombatActor other : arena) {
            if (other.isAlive() && other.isHostileTo(actor)
                    && actor.getPosition().distanceTo(other.getPosition()) <= range) {
                targets.add(other.getActorId());
            }
        }
        return targets;
    }

    // Actions

    /**
     * Submit an action for the active player-team actor.
     * Refused requests return NOT_ALLOWED and change nothing but the log.
     */
    public CombatResult submitAction(CombatAction action) {
        if (!isCombatActive()) {
            return refuse("Combat is over");
        }
        CombatActor actor = getCurrentActor();
        if (!actor.isPlayerTeam()) {
            return refuse("It is " + actor.getName() + "'s turn, not a player-team turn");
        }
        return performAction(actor, action);
    }

    private CombatResult performAction(CombatActor actor, CombatAction action) {
        String reason = action.checkAllowed(actor, this);
        int cost = action.getApCost(rules);
        if (reason == null && !actor.hasAp(cost)) {
            reason = "Not enough AP for " + action.getName() + " (" + actor.getAp() + "/" + cost + ")";
        }
        if (reason != null) {
            return refuse(reason);
        }
        logger.debug("[CombatEncounter] {} performs {}", actor.getName(), action);
        return action.execute(actor, this);
    }

    private CombatResult refuse(String reason) {
        logEvent("Not allowed: " + reason);
        logger.warn("[CombatEncounter] Refused request: {}", reason);
        return CombatResult.notAllowed(reason);
    }

    /**
     * Spend AP, roll the attack and apply any damage, then check for victory.
     */
    CombatResult resolveAttack(CombatActor attacker, CombatActor target, int apCost) {
        attacker.spendAp(apCost);
        AttackRoll roll = resolver.resolve(attacker, target);

        if (!roll.isHit()) {
            String message = attacker.getName() + " misses " + target.getName()
                + "! (Needed " + roll.getHitChance() + "%, rolled " + roll.getRoll() + "%)";
            logEvent(message);
            return CombatResult.miss(attacker.getActorId(), target.getActorId(), message)
                .setChance(roll.getHitChance()).setRoll(roll.getRoll());
        }

        target.applyDamage(roll.getDamage());
        String message = attacker.getName() + " hits " + target.getName() + " for " + roll.getDamage()
            + " damage" + (roll.isCritical() ? " CRITICAL!" : "!");
        logEvent(message);

        CombatResult result;
        if (!target.isAlive()) {
            logEvent(target.getName() + " is down!");
            result = CombatResult.killed(attacker.getActorId(), target.getActorId(), roll.getDamage(), message);
        } else {
            result = CombatResult.hit(attacker.getActorId(), target.getActorId(), roll.getDamage(),
                roll.isCritical(), message);
        }
        checkVictory();
        return result.setChance(roll.getHitChance()).setRoll(roll.getRoll());
    }

    CombatResult moveActor(CombatActor actor, GridPosition destination, int apCost) {
        actor.spendAp(apCost);
        GridPosition from = actor.getPosition();
        actor.moveTo(destination);
        String message = actor.getName() + " moved from " + from + " to " + destination;
        logEvent(message);
        return CombatResult.moved(actor.getActorId(), message);
    }

    // Turn flow

    /**
     * End the active actor's turn and start the next living actor's turn.
     *
     * Round-boundary evaluation (escape availability) completes before the next
     * turn starts and before this method returns.
     */
    public void nextTurn() {
        if (!isCombatActive()) {
            logger.warn("[CombatEncounter] nextTurn called after combat ended");
            return;
        }
        getCurrentActor().endTurn();

        // Evaluate: advance the cursor, assessing escape at any round boundary
        List<Boolean> roundAssessments = new ArrayList<>(1);
        scheduler.advance(id -> arena.get(id).isAlive(), round -> {
            logEvent("=== Round " + round + " ===");
            roundAssessments.add(escapeNegotiator.isEscapeAvailable(round, getPlayerTeam(), getOpponentTeam()));
        });

        // Commit: publish the assessment, then hand the turn over
        for (boolean available : roundAssessments) {
            if (available && !escapeAvailable) {
                logEvent("ESCAPE AVAILABLE - the party may attempt to retreat!");
            }
            escapeAvailable = available;
        }

        CombatActor next = getCurrentActor();
        next.startTurn();
        logTurnBanner(next);
        logger.debug("[CombatEncounter] Round {}: {}'s turn", getRound(), next.getName());

        checkVictory();
    }

    /**
     * Let the opponent controller play the active opponent's turn to completion.
     *
     * @return false if it is not an opponent's turn
     */
    public boolean runOpponentTurn() {
        if (!isOpponentTurn()) {
            return false;
        }
        CombatActor actor = getCurrentActor();
        for (int i = 0; i < MAX_OPPONENT_ACTIONS_PER_TURN; i++) {
            CombatAction action = opponentController.decide(this, actor);
            if (action == null) {
                logEvent(actor.getName() + " holds position");
                nextTurn();
                return true;
            }
            CombatResult result = performAction(actor, action);
            if (!isCombatActive()) {
                return true;
            }
            if (result.isNotAllowed() || actor.getAp() == 0) {
                nextTurn();
                return true;
            }
        }
        logger.warn("[CombatEncounter] {} hit the per-turn action limit", actor.getName());
        nextTurn();
        return true;
    }

    /**
     * Run opponent turns until a player-team actor is up or combat ends.
     */
    public void runOpponentTurns() {
        while (isOpponentTurn()) {
            runOpponentTurn();
        }
    }

    // Escape

    /**
     * Attempt to escape unassisted. The leader is the first living actor in the
     * player roster; its reflexes set the chance and it takes the failure penalty.
     */
    public CombatResult attemptEscape() {
        return resolveEscape(null);
    }

    /**
     * Attempt to escape, leaving the given player-team actor behind. The
     * sacrifice is lost whether or not the escape succeeds.
     */
    public CombatResult attemptEscape(int sacrificeId) {
        return resolveEscape(sacrificeId);
    }

    private CombatResult resolveEscape(Integer sacrificeId) {
        if (!isCombatActive()) {
            return refuse("Combat is over");
        }
        if (!getCurrentActor().isPlayerTeam()) {
            return refuse("Escape can only be attempted on a player-team turn");
        }
        if (!escapeAvailable) {
            return refuse("Escape not available yet (round " + rules.getEscapeMinRound() + "+ required)");
        }

        CombatActor sacrifice = null;
        if (sacrificeId != null) {
            if (sacrificeId < 0 || sacrificeId >= arena.size()) {
                return refuse("No actor with id " + sacrificeId);
            }
            sacrifice = arena.get(sacrificeId);
            if (!sacrifice.isPlayerTeam() || !sacrifice.isAlive()) {
                return refuse(sacrifice.getName() + " cannot stay behind");
            }
            if (countLiving(getPlayerTeam()) < 2) {
                return refuse("Nobody would be left to escape");
            }
        }

        CombatActor leader = getPlayerTeam().stream()
            .filter(CombatActor::isAlive)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Player team has no living actor"));
        int chance = escapeNegotiator.calculateEscapeChance(leader, sacrifice != null);

        if (sacrifice != null) {
            logEvent(sacrifice.getName() + " stays behind to cover the retreat!");
            sacrifice.markDefeated();
        } else {
            logEvent("Attempting escape... (" + chance + "% chance)");
        }

        int roll = escapeNegotiator.roll();
        if (roll <= chance) {
            for (CombatActor member : getPlayerTeam()) {
                if (member.isAlive()) {
                    member.loseMorale(escapeNegotiator.getMoralePenalty());
                }
            }
            String message = sacrifice != null
                ? sacrifice.getName() + " died buying time. Party escaped."
                : "Escape successful! Retreated from combat.";
            logEvent(message);
            terminate(CombatOutcome.FLED);
            return CombatResult.escaped(message).setChance(chance).setRoll(roll);
        }

        CombatResult result;
        if (sacrifice != null) {
            String message = "Escape FAILED! " + sacrifice.getName() + " died in vain!";
            logEvent(message);
            result = CombatResult.escapeFailed(sacrifice.getActorId(), 0, message);
        } else {
            int penalty = escapeNegotiator.calculateFailurePenalty(leader);
            leader.applyDamage(penalty);
            String message = "Escape FAILED! " + leader.getName() + " took " + penalty + " damage.";
            logEvent(message);
            if (!leader.isAlive()) {
                logEvent(leader.getName() + " is down!");
            }
            result = CombatResult.escapeFailed(leader.getActorId(), penalty, message);
        }
        result.setChance(chance).setRoll(roll);

        checkVictory();
        if (isCombatActive() && !getCurrentActor().isAlive()) {
            nextTurn();
        }
        return result;
    }

    // Resolution

    private static long countLiving(List<CombatActor> team) {
        return team.stream().filter(CombatActor::isAlive).count();
    }

    /**
     * Terminate with DEFEAT or VICTORY if a team has been wiped out.
     */
    private void checkVictory() {
        if (!isCombatActive()) return;

        if (countLiving(getPlayerTeam()) == 0) {
            logEvent("=== DEFEAT ===");
            terminate(CombatOutcome.DEFEAT);
        } else if (countLiving(getOpponentTeam()) == 0) {
            logEvent("=== VICTORY ===");
            terminate(CombatOutcome.VICTORY);
        }
    }

    private void terminate(CombatOutcome result) {
        state = CombatState.TERMINATED;
        outcome = result;
        String survivors = arena.stream()
            .filter(CombatActor::isAlive)
            .map(CombatActor::getName)
            .collect(Collectors.joining(", "));
        logger.info("[CombatEncounter] Ended in round {} with {}; survivors: {}",
            getRound(), result.getDisplayName(), survivors.isEmpty() ? "none" : survivors);
    }

    // Combat Log

    public void logEvent(String event) {
        combatLog.add("[R" + getRoundForLog() + "] " + event);
    }

    private int getRoundForLog() {
        return scheduler != null ? scheduler.getRound() : 1;
    }

    private void logTurnBanner(CombatActor actor) {
        logEvent(">>> " + actor.getName() + "'s turn (" + actor.getTeam().getDisplayName() + ") <<<");
    }

    public List<String> getCombatLog() {
        return Collections.unmodifiableList(combatLog);
    }

    public String getRecentLog(int lines) {
        int start = Math.max(0, combatLog.size() - lines);
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < combatLog.size(); i++) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(combatLog.get(i));
        }
        return sb.toString();
    }

    /**
     * Get a summary of the encounter state.
     */
    public String getSummary() {
        String status = outcome != null ? outcome.getDisplayName() : state.getDisplayName();
        return String.format("Encounter [%s] Round %d - %d/%d players, %d/%d opponents standing",
            status, getRound(),
            countLiving(getPlayerTeam()), playerCount,
            countLiving(getOpponentTeam()), arena.size() - playerCount);
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
