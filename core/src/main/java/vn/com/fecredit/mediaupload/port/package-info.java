/**
 * This package defines the ports for the upload engine.
 * In a Ports and Adapters architecture, ports are interfaces that define
 * how the application core interacts with external systems (session database,
 * chunk storage, artifact storage). Exactly one adapter per port is chosen
 * when the engine is constructed.
 */
package vn.com.fecredit.mediaupload.port;
