/**
 * Small internal helpers shared by the loops.
 */
package reconciler.util;
