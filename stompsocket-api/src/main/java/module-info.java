/**
 * StompSocket API module.
 *
 * <p>Provides the client-side STOMP session interfaces, the event vocabulary
 * and the engine SPI implemented on top of a STOMP client library.</p>
 */
module stompsocket.api
{
    exports org.abstractica.stompsocket;
    exports org.abstractica.stompsocket.handlers;
    exports org.abstractica.stompsocket.engine;
}
