package ideavalidator;

/**
 * A class in the shared ancestor package of every module, used as the root when scanning for beans.
 */
public class Marker {
}
