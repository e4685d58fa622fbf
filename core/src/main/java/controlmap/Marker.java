package controlmap;

/**
 * A class in the shared root package, used by Weld to scan every module for beans.
 */
public class Marker {
}
