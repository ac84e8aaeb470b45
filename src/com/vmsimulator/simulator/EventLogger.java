package com.vmsimulator.simulator;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * EventLogger
 *
 * Registro de eventos thread-safe. Mantiene una lista interna de entradas y
 * permite registrar listeners que serán notificados cada vez que se añada
 * una nueva entrada.
 */
public class EventLogger {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final List<String> events;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<EventListener> listeners;

    /**
     * Interfaz usada por listeners que desean recibir notificaciones de nuevos
     * eventos.
     */
    public interface EventListener {
        /**
         * Invocado cuando se registra un nuevo evento.
         *
         * @param event entrada de log ya formateada con timestamp
         */
        void eventLogged(String event);
    }

    /**
     * Construye un EventLogger vacío.
     */
    public EventLogger() {
        this.events = new ArrayList<>();
        this.listeners = new ArrayList<>();
    }

    /**
     * Registra un mensaje con timestamp en la lista interna y notifica listeners.
     * Un listener que falla no impide notificar al resto; su error se anota en
     * el propio log.
     *
     * @param message mensaje a registrar
     */
    public void log(String message) {
        lock.lock();
        try {
            String logEntry = "[" + LocalDateTime.now().format(TIMESTAMP) + "] " + message;
            events.add(logEntry);
            for (EventListener listener : listeners) {
                try {
                    listener.eventLogged(logEntry);
                } catch (RuntimeException e) {
                    events.add("[" + LocalDateTime.now().format(TIMESTAMP) + "] listener failed: " + e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registra un listener que será notificado en cada nuevo evento.
     *
     * @param listener listener a añadir
     */
    public void addListener(EventListener listener) {
        lock.lock();
        try {
            listeners.add(listener);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Elimina un listener registrado previamente.
     *
     * @param listener listener a quitar
     */
    public void removeListener(EventListener listener) {
        lock.lock();
        try {
            listeners.remove(listener);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Devuelve una copia de las entradas registradas.
     *
     * @return lista de entradas en orden de registro
     */
    public List<String> getEvents() {
        lock.lock();
        try {
            return new ArrayList<>(events);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Descarta todas las entradas (los listeners se conservan).
     */
    public void clear() {
        lock.lock();
        try {
            events.clear();
        } finally {
            lock.unlock();
        }
    }
}
